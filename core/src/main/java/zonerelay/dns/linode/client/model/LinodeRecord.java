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

/**
 * A domain record as exchanged with the Linode API.
 *
 * <p>Unset fields are omitted when serialized. {@code id} is only present in responses.
 *
 * @see <a href="https://techdocs.akamai.com/linode-api/reference/post-domain-record">Create a
 *     domain record</a>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LinodeRecord(
    @JsonProperty("id") @Nullable Long id,
    @JsonProperty("type") String type,
    @JsonProperty("name") @Nullable String name,
    @JsonProperty("target") @Nullable String target,
    @JsonProperty("priority") @Nullable Integer priority,
    @JsonProperty("weight") @Nullable Integer weight,
    @JsonProperty("port") @Nullable Integer port,
    @JsonProperty("service") @Nullable String service,
    @JsonProperty("protocol") @Nullable String protocol,
    @JsonProperty("tag") @Nullable String tag,
    @JsonProperty("ttl_sec") @Nullable Integer ttlSec) {

  public static Builder builder(String type) {
    return new Builder(type);
  }

  public Builder asBuilder() {
    return new Builder(type)
        .setId(id)
        .setName(name)
        .setTarget(target)
        .setPriority(priority)
        .setWeight(weight)
        .setPort(port)
        .setService(service)
        .setProtocol(protocol)
        .setTag(tag)
        .setTtlSec(ttlSec);
  }

  /** Builder for {@link LinodeRecord}. */
  public static final class Builder {
    private final String type;
    private Long id;
    private String name;
    private String target;
    private Integer priority;
    private Integer weight;
    private Integer port;
    private String service;
    private String protocol;
    private String tag;
    private Integer ttlSec;

    private Builder(String type) {
      this.type = type;
    }

    public Builder setId(@Nullable Long id) {
      this.id = id;
      return this;
    }

    public Builder setName(@Nullable String name) {
      this.name = name;
      return this;
    }

    public Builder setTarget(@Nullable String target) {
      this.target = target;
      return this;
    }

    public Builder setPriority(@Nullable Integer priority) {
      this.priority = priority;
      return this;
    }

    public Builder setWeight(@Nullable Integer weight) {
      this.weight = weight;
      return this;
    }

    public Builder setPort(@Nullable Integer port) {
      this.port = port;
      return this;
    }

    public Builder setService(@Nullable String service) {
      this.service = service;
      return this;
    }

    public Builder setProtocol(@Nullable String protocol) {
      this.protocol = protocol;
      return this;
    }

    public Builder setTag(@Nullable String tag) {
      this.tag = tag;
      return this;
    }

    public Builder setTtlSec(@Nullable Integer ttlSec) {
      this.ttlSec = ttlSec;
      return this;
    }

    public LinodeRecord build() {
      return new LinodeRecord(
          id, type, name, target, priority, weight, port, service, protocol, tag, ttlSec);
    }
  }
}
