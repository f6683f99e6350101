package ladder;

public interface Named {
  String name();
}
