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

package zonerelay.config;

import static com.google.common.base.Suppliers.memoize;
import static zonerelay.util.ResourceUtils.readOptionalResourceUtf8;
import static zonerelay.util.ResourceUtils.readResourceUtf8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import dagger.Module;
import dagger.Provides;
import jakarta.inject.Qualifier;
import jakarta.inject.Singleton;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.time.Duration;
import java.util.function.Supplier;
import zonerelay.util.YamlUtils;

/**
 * Central clearing-house for all configuration.
 *
 * <p>Settings are loaded from {@code files/default-config.yaml}, overlaid by an optional {@code
 * files/env-<environment>.yaml}. The environment name comes from the {@value #ENVIRONMENT_PROPERTY}
 * system property and defaults to {@value #DEFAULT_ENVIRONMENT}.
 */
public final class RelayConfig {

  public static final String ENVIRONMENT_PROPERTY = "zonerelay.environment";
  public static final String API_KEY_ENV_VARIABLE = "LINODE_API_KEY";

  private static final String DEFAULT_ENVIRONMENT = "local";
  private static final String YAML_CONFIG_DEFAULT = "files/default-config.yaml";
  private static final String YAML_CONFIG_ENV_TEMPLATE = "files/env-%s.yaml";

  /** Dagger qualifier for configuration settings. */
  @Qualifier
  @Retention(RetentionPolicy.RUNTIME)
  @Documented
  public @interface Config {
    String value() default "";
  }

  /** Dagger module for injecting configuration settings. */
  @Module
  public static final class ConfigModule {

    @Provides
    @Singleton
    static RelayConfigSettings provideRelayConfigSettings() {
      return CONFIG_SETTINGS.get();
    }

    /** Base URL of the versioned Linode REST API, e.g. {@code https://api.linode.com/v4}. */
    @Provides
    @Config("linodeApiUrl")
    public static String provideLinodeApiUrl(RelayConfigSettings config) {
      return config.linode.apiUrl;
    }

    /**
     * Personal access token used against the Linode API.
     *
     * <p>The {@value RelayConfig#API_KEY_ENV_VARIABLE} environment variable wins over the YAML
     * value so that tokens need not be written to disk.
     */
    @Provides
    @Config("linodeApiKey")
    public static String provideLinodeApiKey(RelayConfigSettings config) {
      String fromEnvironment = System.getenv(API_KEY_ENV_VARIABLE);
      return Strings.isNullOrEmpty(fromEnvironment)
          ? Strings.nullToEmpty(config.linode.apiKey)
          : fromEnvironment;
    }

    /** Number of entries requested per page from list endpoints; Linode caps this at 100. */
    @Provides
    @Config("linodePageSize")
    public static int provideLinodePageSize(RelayConfigSettings config) {
      return config.linode.pageSize;
    }

    @Provides
    @Config("linodeConnectTimeout")
    public static Duration provideLinodeConnectTimeout(RelayConfigSettings config) {
      return Duration.ofSeconds(config.linode.connectTimeoutSeconds);
    }

    @Provides
    @Config("linodeReadTimeout")
    public static Duration provideLinodeReadTimeout(RelayConfigSettings config) {
      return Duration.ofSeconds(config.linode.readTimeoutSeconds);
    }

    /** TTL applied to records whose TTL was not given. */
    @Provides
    @Config("dnsDefaultTtl")
    public static int provideDnsDefaultTtl(RelayConfigSettings config) {
      return config.dns.defaultTtl;
    }

    /** Nameservers that are authoritative for every zone hosted by the provider. */
    @Provides
    @Config("dnsHostingNameservers")
    public static ImmutableList<String> provideDnsHostingNameservers(RelayConfigSettings config) {
      return ImmutableList.copyOf(config.dns.hostingNameservers);
    }

    /** How many times zone creation checks that the new zone is visible before giving up. */
    @Provides
    @Config("zoneAuthorityPollAttempts")
    public static int provideZoneAuthorityPollAttempts(RelayConfigSettings config) {
      return config.dns.zoneAuthorityPollAttempts;
    }

    @Provides
    @Config("zoneAuthorityPollInterval")
    public static Duration provideZoneAuthorityPollInterval(RelayConfigSettings config) {
      return Duration.ofMillis(config.dns.zoneAuthorityPollIntervalMillis);
    }

    @Provides
    @Config("soaLookupTimeout")
    public static Duration provideSoaLookupTimeout(RelayConfigSettings config) {
      return Duration.ofSeconds(config.dns.soaLookupTimeoutSeconds);
    }

    private ConfigModule() {}
  }

  /** Returns the name of the environment whose overlay file is applied. */
  public static String getEnvironment() {
    return System.getProperty(ENVIRONMENT_PROPERTY, DEFAULT_ENVIRONMENT);
  }

  /**
   * Loads settings of type {@code T} from a default YAML resource and the overlay for the given
   * environment, if one exists.
   */
  @VisibleForTesting
  static <T> T getEnvironmentConfigSettings(
      String defaultYamlResource, String envYamlTemplate, String environment, Class<T> clazz) {
    String defaultYaml = readResourceUtf8(RelayConfig.class, defaultYamlResource);
    String customYaml =
        readOptionalResourceUtf8(RelayConfig.class, String.format(envYamlTemplate, environment))
            .orElse("");
    return YamlUtils.getConfigSettings(defaultYaml, customYaml, clazz);
  }

  /**
   * Memoizes loading of the {@link RelayConfigSettings} POJO.
   *
   * <p>Memoizing without cache expiration is used because the process must be restarted in order
   * to change the contents of the YAML config files.
   */
  @VisibleForTesting
  public static final Supplier<RelayConfigSettings> CONFIG_SETTINGS =
      memoize(
          () ->
              getEnvironmentConfigSettings(
                  YAML_CONFIG_DEFAULT,
                  YAML_CONFIG_ENV_TEMPLATE,
                  getEnvironment(),
                  RelayConfigSettings.class));

  private RelayConfig() {}
}
