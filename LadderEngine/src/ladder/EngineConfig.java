package ladder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import com.google.errorprone.annotations.ForOverride;

/** Tunables of the rung engine and the controller-level analyses. */
@AutoValue
public abstract class EngineConfig {
  public static final int DEFAULT_ALIAS_HOP_LIMIT = 32;
  public static final String DEFAULT_DIAGNOSTIC_MARKER = "<@DIAG>";

  // First-scan system flags; they are never driven by user logic.
  public static final ImmutableSet<String> DEFAULT_IGNORED_INPUTS =
      ImmutableSet.of("S:FS", "S:Fs", "S:fs", "s:fs", "s:FS");

  private static final EngineConfig DEFAULTS = builder().build();

  public abstract int aliasHopLimit();

  public abstract String diagnosticMarker();

  public abstract Optional<String> diagnosticRoutineName();

  public abstract ImmutableSet<String> ignoredInputs();

  public static EngineConfig defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new AutoValue_EngineConfig.Builder()
        .setAliasHopLimit(DEFAULT_ALIAS_HOP_LIMIT)
        .setDiagnosticMarker(DEFAULT_DIAGNOSTIC_MARKER)
        .setIgnoredInputs(DEFAULT_IGNORED_INPUTS);
  }

  public abstract Builder toBuilder();

  public AliasResolver aliasResolver() {
    return new AliasResolver(aliasHopLimit());
  }

  /** Reads a configuration object; keys that are absent keep their defaults. */
  public static EngineConfig fromJson(JSONObject json) throws LadderException {
    Builder builder = builder();
    try {
      if (json.has("aliasHopLimit")) builder.setAliasHopLimit(json.getInt("aliasHopLimit"));
      if (json.has("diagnosticMarker"))
        builder.setDiagnosticMarker(json.getString("diagnosticMarker"));
      if (json.has("diagnosticRoutineName"))
        builder.setDiagnosticRoutineName(json.getString("diagnosticRoutineName"));
      if (json.has("ignoredInputs")) {
        JSONArray ignored = json.getJSONArray("ignoredInputs");
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        for (int i = 0; i < ignored.length(); i++) {
          names.add(ignored.getString(i));
        }
        builder.setIgnoredInputs(names.build());
      }
      return builder.build();
    } catch (JSONException | IllegalStateException ex) {
      throw LadderException.configuration("malformed configuration: %s", ex.getMessage());
    }
  }

  public static EngineConfig load(File file) throws IOException, LadderException {
    String content = Files.asCharSource(file, StandardCharsets.UTF_8).read();
    try {
      return fromJson(new JSONObject(content));
    } catch (JSONException ex) {
      throw LadderException.configuration("%s is not a JSON object: %s", file, ex.getMessage());
    }
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setAliasHopLimit(int aliasHopLimit);

    public abstract Builder setDiagnosticMarker(String diagnosticMarker);

    public abstract Builder setDiagnosticRoutineName(String diagnosticRoutineName);

    public abstract Builder setIgnoredInputs(Iterable<String> ignoredInputs);

    @ForOverride
    abstract EngineConfig autoBuild();

    public final EngineConfig build() {
      EngineConfig config = autoBuild();
      if (config.aliasHopLimit() <= 0)
        throw new IllegalStateException(
            "aliasHopLimit must be positive: " + config.aliasHopLimit());
      return config;
    }
  }
}
