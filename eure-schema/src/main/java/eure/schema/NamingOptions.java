package eure.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Global and per-type [RenameRule]s declared with `$rename-all`
public record NamingOptions(RenameRule global, Map<String, RenameRule> perType) {

  public static final NamingOptions NONE = new NamingOptions(null, Map.of());

  public NamingOptions {
    perType = Collections.unmodifiableMap(new LinkedHashMap<>(perType));
  }

  /// Rule in force for `typeName`: its own rule, else the global one
  public Optional<RenameRule> ruleFor(String typeName) {
    final var own = perType.get(typeName);
    return Optional.ofNullable(own != null ? own : global);
  }
}
