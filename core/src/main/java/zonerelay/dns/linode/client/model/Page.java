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
import com.google.common.collect.ImmutableList;
import java.util.List;

/** One page of a paginated Linode list response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Page<T>(
    @JsonProperty("data") List<T> data,
    @JsonProperty("page") int page,
    @JsonProperty("pages") int pages,
    @JsonProperty("results") int results) {

  public Page {
    data = data == null ? ImmutableList.of() : ImmutableList.copyOf(data);
  }

  public boolean hasMorePages() {
    return page < pages && !data.isEmpty();
  }
}
