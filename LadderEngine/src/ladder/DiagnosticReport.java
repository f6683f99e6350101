package ladder;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

@AutoValue
public abstract class DiagnosticReport {
  public abstract ImmutableList<Rung> diagnosticRungs();

  public abstract ImmutableListMultimap<String, DiagnosticMessage> messagesByTextList();

  // Every message whose text list entry was already claimed by an earlier message.
  public abstract ImmutableList<DiagnosticMessage> duplicates();

  public ImmutableList<DiagnosticMessage> messages() {
    return ImmutableList.copyOf(messagesByTextList().values());
  }

  public boolean hasDuplicates() {
    return !duplicates().isEmpty();
  }

  static DiagnosticReport create(
      ImmutableList<Rung> diagnosticRungs,
      ImmutableListMultimap<String, DiagnosticMessage> messagesByTextList,
      ImmutableList<DiagnosticMessage> duplicates) {
    return new AutoValue_DiagnosticReport(diagnosticRungs, messagesByTextList, duplicates);
  }
}
