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

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nullable;
import zonerelay.dns.linode.client.model.LinodeErrorResponse;

/** Custom exception for Linode API client errors. */
public class LinodeApiException extends IOException {

  @Nullable private final Integer statusCode;
  @Nullable private final String responseBody;
  @Nullable private final LinodeErrorResponse errorResponse;

  public LinodeApiException(
      String message,
      int statusCode,
      String responseBody,
      @Nullable LinodeErrorResponse errorResponse) {
    super(message);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
    this.errorResponse = errorResponse;
  }

  public LinodeApiException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = null;
    this.responseBody = null;
    this.errorResponse = null;
  }

  /** The HTTP status of the failed response; absent for transport failures. */
  public OptionalInt getStatusCode() {
    return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }

  public Optional<String> getResponseBody() {
    return Optional.ofNullable(responseBody);
  }

  public Optional<LinodeErrorResponse> getErrorResponse() {
    return Optional.ofNullable(errorResponse);
  }

  /**
   * Returns the reason of the first error in the response body, falling back to the exception
   * message when the body carries none.
   */
  public String renderReason() {
    return getErrorResponse().flatMap(LinodeErrorResponse::firstReason).orElse(getMessage());
  }

  /** Thrown when Linode returns a 401 Unauthorized error. */
  public static class LinodeAuthorizationException extends LinodeApiException {
    public LinodeAuthorizationException(
        String message, String responseBody, @Nullable LinodeErrorResponse errorResponse) {
      super(message, 401, responseBody, errorResponse);
    }
  }
}
