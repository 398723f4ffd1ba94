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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import javax.annotation.Nullable;

/** A zone ("domain" in Linode terms) owned by the API credential. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LinodeDomain(
    @JsonProperty("id") @Nullable Long id,
    @JsonProperty("domain") String domain,
    @JsonProperty("type") String type,
    @JsonProperty("status") @Nullable String status,
    @JsonProperty("soa_email") @Nullable String soaEmail) {

  public static final String TYPE_MASTER = "master";

  /** Returns the creation request for a primary zone administered by {@code hostmaster@domain}. */
  public static LinodeDomain newMasterZone(String domain) {
    return new LinodeDomain(null, domain, TYPE_MASTER, null, "hostmaster@" + domain);
  }
}
