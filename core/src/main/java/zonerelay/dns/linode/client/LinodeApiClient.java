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

package zonerelay.dns.linode.client;

import static com.google.common.base.Preconditions.checkArgument;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Throwables;
import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.Map;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import zonerelay.config.RelayConfig.Config;
import zonerelay.dns.linode.client.LinodeApiException.LinodeAuthorizationException;
import zonerelay.dns.linode.client.model.LinodeErrorResponse;

/**
 * A low-level client for the Linode REST API.
 *
 * <p>Every request carries the personal access token as a bearer token. Responses outside the 2xx
 * range are turned into a {@link LinodeApiException}, or a {@link LinodeAuthorizationException}
 * for 401, with the error body attached.
 */
@Singleton
public class LinodeApiClient {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final MediaType JSON = MediaType.parse("application/json");

  private final OkHttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final HttpUrl baseUrl;
  private final String apiKey;

  /** A successful response; the body is fully read so nothing needs closing. */
  public record ApiResponse(int statusCode, String body) {}

  @Inject
  public LinodeApiClient(
      @Named("linodeHttpClient") OkHttpClient httpClient,
      ObjectMapper objectMapper,
      @Config("linodeApiUrl") String apiUrl,
      @Config("linodeApiKey") String apiKey) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    HttpUrl parsed = HttpUrl.parse(apiUrl);
    checkArgument(parsed != null, "Invalid Linode API URL configuration: %s", apiUrl);
    this.baseUrl = parsed;
    this.apiKey = apiKey;
  }

  /**
   * Sends a request to the given API path.
   *
   * @param method HTTP method, e.g. {@code GET}
   * @param path path relative to the API root, e.g. {@code domains/12/records}
   * @param queryParams query parameters to be URL-encoded and appended to the request
   * @param jsonBody request body, or null to send none
   * @throws LinodeAuthorizationException if the server returns a 401 Unauthorized status
   * @throws LinodeApiException if the request fails or returns any other non-2xx status
   */
  public ApiResponse send(
      String method, String path, Map<String, String> queryParams, @Nullable String jsonBody)
      throws LinodeApiException {
    HttpUrl url = buildUrl(path, queryParams);
    RequestBody requestBody = jsonBody == null ? null : RequestBody.create(jsonBody, JSON);
    Request request =
        new Request.Builder()
            .url(url)
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json")
            .method(method, requestBody)
            .build();
    try (Response response = logAndExecuteRequest(request, jsonBody)) {
      ResponseBody body = response.body();
      String responseBody = body == null ? "" : body.string();
      if (response.code() == HttpURLConnection.HTTP_UNAUTHORIZED) {
        throw new LinodeAuthorizationException(
            String.format("Linode rejected the API key for %s %s", method, url.encodedPath()),
            responseBody,
            parseErrorResponse(responseBody));
      }
      if (!response.isSuccessful()) {
        throw new LinodeApiException(
            String.format(
                "Linode returned HTTP %d for %s %s", response.code(), method, url.encodedPath()),
            response.code(),
            responseBody,
            parseErrorResponse(responseBody));
      }
      return new ApiResponse(response.code(), responseBody);
    } catch (RuntimeException | IOException e) {
      Throwables.throwIfInstanceOf(e, LinodeApiException.class);
      throw new LinodeApiException(String.format("Error during %s request to %s", method, url), e);
    }
  }

  public ApiResponse get(String path, Map<String, String> queryParams) throws LinodeApiException {
    return send("GET", path, queryParams, null);
  }

  public ApiResponse post(String path, String jsonBody) throws LinodeApiException {
    return send("POST", path, Map.of(), jsonBody);
  }

  public ApiResponse put(String path, String jsonBody) throws LinodeApiException {
    return send("PUT", path, Map.of(), jsonBody);
  }

  public ApiResponse delete(String path) throws LinodeApiException {
    return send("DELETE", path, Map.of(), null);
  }

  private Response logAndExecuteRequest(Request request, @Nullable String jsonBody)
      throws IOException {
    logger.atInfo().log(
        "Executing Linode request: %s, url: %s, body: %s",
        request.method(), request.url(), jsonBody);
    long startTime = System.currentTimeMillis();
    Response response = httpClient.newCall(request).execute();
    long endTime = System.currentTimeMillis();
    logger.atInfo().log(
        "Completed Linode request in %d ms, success: %s, response code: %d",
        endTime - startTime, response.isSuccessful(), response.code());
    return response;
  }

  @Nullable
  private LinodeErrorResponse parseErrorResponse(String responseBody) {
    if (responseBody.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.readValue(responseBody, LinodeErrorResponse.class);
    } catch (JsonProcessingException e) {
      logger.atFine().withCause(e).log("Linode error body is not JSON: %s", responseBody);
      return null;
    }
  }

  private HttpUrl buildUrl(String path, Map<String, String> queryParams) {
    String sanitizedPath = path.startsWith("/") ? path.substring(1) : path;
    HttpUrl.Builder urlBuilder = baseUrl.newBuilder().addPathSegments(sanitizedPath);
    if (queryParams != null) {
      queryParams.forEach(urlBuilder::addQueryParameter);
    }
    return urlBuilder.build();
  }
}
