package ladder;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/** Creates controllers by type. Every {@link ControllerType} has exactly one entry. */
public final class ControllerFactory {
  public static final String GM_DIAGNOSTIC_ROUTINE = "zZ999_Diagnostics";

  @FunctionalInterface
  interface Constructor {
    Controller create(String name, EngineConfig config);
  }

  private static final ImmutableMap<ControllerType, Constructor> REGISTRY =
      ImmutableMap.<ControllerType, Constructor>builder()
          .put(
              ControllerType.GENERIC,
              (name, config) -> new Controller(name, ControllerType.GENERIC, config))
          .put(ControllerType.GM, ControllerFactory::createGm)
          .build();

  public static Controller create(ControllerType type, String name) {
    return create(type, name, EngineConfig.defaults());
  }

  public static Controller create(ControllerType type, String name, EngineConfig config) {
    Constructor constructor = REGISTRY.get(type);
    Preconditions.checkArgument(constructor != null, "no constructor registered for %s", type);
    return constructor.create(name, config);
  }

  // GM projects keep their diagnostic messages in a dedicated routine unless told otherwise.
  private static Controller createGm(String name, EngineConfig config) {
    EngineConfig gmConfig =
        config.diagnosticRoutineName().isPresent()
            ? config
            : config.toBuilder().setDiagnosticRoutineName(GM_DIAGNOSTIC_ROUTINE).build();
    return new Controller(name, ControllerType.GM, gmConfig);
  }

  private ControllerFactory() {}
}
