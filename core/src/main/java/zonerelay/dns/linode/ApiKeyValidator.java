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

package zonerelay.dns.linode;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import okhttp3.OkHttpClient;
import zonerelay.config.RelayConfig.Config;
import zonerelay.dns.DnsProviderException.InvalidApiKeyException;
import zonerelay.dns.linode.client.LinodeApiClient;
import zonerelay.dns.linode.client.LinodeApiException;
import zonerelay.dns.linode.client.model.LinodeErrorResponse;

/** Checks that a Linode personal access token is well formed and accepted by the API. */
public class ApiKeyValidator {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final CharMatcher HEX_DIGIT =
      CharMatcher.inRange('0', '9')
          .or(CharMatcher.inRange('a', 'f'))
          .or(CharMatcher.inRange('A', 'F'))
          .precomputed();
  private static final String DEFAULT_REASON = "Invalid key";

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String apiUrl;

  @Inject
  public ApiKeyValidator(
      @Named("linodeHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      @Config("linodeApiUrl") String apiUrl) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.apiUrl = apiUrl;
  }

  /**
   * Validates {@code key} by fetching the account it belongs to.
   *
   * @throws InvalidApiKeyException if the key is not a hexadecimal string, in which case no
   *     request is sent, or if Linode refuses it
   */
  public void validate(String key) throws InvalidApiKeyException {
    if (key == null || key.isEmpty() || !HEX_DIGIT.matchesAllOf(key)) {
      throw new InvalidApiKeyException("Linode API key must be a non-empty hexadecimal string");
    }
    LinodeApiClient client = new LinodeApiClient(httpClient, objectMapper, apiUrl, key);
    try {
      client.get("account", ImmutableMap.of());
    } catch (LinodeApiException e) {
      String reason =
          e.getErrorResponse().flatMap(LinodeErrorResponse::firstReason).orElse(DEFAULT_REASON);
      throw new InvalidApiKeyException("Linode key failed: " + reason, e);
    }
    logger.atInfo().log("Linode API key accepted");
  }
}
