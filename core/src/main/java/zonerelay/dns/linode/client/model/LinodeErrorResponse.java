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

package zonerelay.dns.linode.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The JSON body Linode returns alongside a 4xx or 5xx status.
 *
 * @see <a href="https://techdocs.akamai.com/linode-api/reference/errors">Linode API errors</a>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LinodeErrorResponse(@JsonProperty("errors") List<ApiError> errors) {

  public LinodeErrorResponse {
    errors = errors == null ? ImmutableList.of() : ImmutableList.copyOf(errors);
  }

  /** Returns the reason of the first error, if it has one. */
  public Optional<String> firstReason() {
    if (errors.isEmpty() || Strings.isNullOrEmpty(errors.get(0).reason())) {
      return Optional.empty();
    }
    return Optional.of(errors.get(0).reason());
  }

  /** A single error; {@code field} names the offending request field when there is one. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ApiError(
      @JsonProperty("field") @Nullable String field, @JsonProperty("reason") String reason) {}
}
