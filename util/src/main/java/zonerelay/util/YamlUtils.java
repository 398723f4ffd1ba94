// Copyright 2025 The Zonerelay Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package zonerelay.util;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.flogger.FluentLogger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;

/**
 * Utility methods for dealing with YAML.
 *
 * <p>There are no third-party YAML libraries that support merging fields in the way that we want,
 * so a default configuration file is overlaid with an optional environment-specific one here before
 * the result is bound to a settings POJO.
 */
public final class YamlUtils {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Loads the POJO of type {@code T} from merged YAML configuration files.
   *
   * @param defaultYaml content of the default YAML file.
   * @param customYaml content of the overlay YAML file, possibly empty.
   * @param clazz type of the POJO loaded from the merged YAML files.
   * @throws IllegalStateException if the default YAML does not contain a map at its root.
   */
  public static <T> T getConfigSettings(String defaultYaml, String customYaml, Class<T> clazz) {
    String mergedYaml = mergeYaml(defaultYaml, customYaml);
    return new Yaml().loadAs(mergedYaml, clazz);
  }

  /**
   * Recursively merges two YAML documents together.
   *
   * <p>Any fields that are specified in customYaml will override fields of the same path in
   * defaultYaml. Additional fields in customYaml that aren't specified in defaultYaml will be
   * ignored, since they would not bind to any settings field anyway.
   */
  static String mergeYaml(String defaultYaml, String customYaml) {
    Yaml yaml = new Yaml();
    Optional<Map<String, Object>> defaults = loadAsMap(yaml, defaultYaml);
    checkState(defaults.isPresent(), "Default YAML config did not contain a map at its root");
    Map<String, Object> merged = defaults.get();
    Optional<Map<String, Object>> custom = loadAsMap(yaml, customYaml);
    if (custom.isPresent()) {
      merged = mergeMaps(merged, custom.get());
      logger.atFine().log("Merged YAML overlay with %d top-level keys.", custom.get().size());
    }
    return yaml.dump(merged);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> mergeMaps(
      Map<String, Object> defaultMap, Map<String, Object> customMap) {
    Map<String, Object> result = new LinkedHashMap<>(defaultMap);
    for (Map.Entry<String, Object> entry : defaultMap.entrySet()) {
      String key = entry.getKey();
      if (!customMap.containsKey(key)) {
        continue;
      }
      Object defaultValue = entry.getValue();
      Object customValue = customMap.get(key);
      if (defaultValue instanceof Map && customValue instanceof Map) {
        result.put(
            key,
            mergeMaps((Map<String, Object>) defaultValue, (Map<String, Object>) customValue));
      } else {
        result.put(key, customValue);
      }
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  private static Optional<Map<String, Object>> loadAsMap(Yaml yaml, String yamlString) {
    Object loaded = yaml.load(yamlString);
    if (loaded instanceof Map) {
      return Optional.of((Map<String, Object>) loaded);
    }
    return Optional.empty();
  }

  private YamlUtils() {}
}
