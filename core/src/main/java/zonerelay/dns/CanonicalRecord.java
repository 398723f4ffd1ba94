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

package zonerelay.dns;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A validated, normalized DNS record.
 *
 * <p>{@code name} is relative to {@code zone} and empty for the apex. {@code parameter} is always
 * equal to {@code data.toParameter()}. {@code providerId} is the identifier the remote provider
 * assigned to the record, when known.
 */
public record CanonicalRecord(
    String zone,
    String name,
    RecordType type,
    String parameter,
    int ttl,
    RecordData data,
    @Nullable Long providerId) {

  public CanonicalRecord {
    checkNotNull(zone, "zone");
    checkNotNull(name, "name");
    checkNotNull(type, "type");
    checkNotNull(parameter, "parameter");
    checkNotNull(data, "data");
  }

  /** Creates a record whose parameter is rendered from its typed data. */
  public static CanonicalRecord create(
      String zone, String name, RecordType type, int ttl, RecordData data) {
    return new CanonicalRecord(zone, name, type, data.toParameter(), ttl, data, null);
  }

  public CanonicalRecord withProviderId(@Nullable Long id) {
    return new CanonicalRecord(zone, name, type, parameter, ttl, data, id);
  }

  public Optional<Long> getProviderId() {
    return Optional.ofNullable(providerId);
  }

  public RecordKey getKey() {
    return new RecordKey(name, type, parameter);
  }

  /** Returns the fully qualified owner name without a trailing dot. */
  public String getFqdn() {
    return name.isEmpty() ? zone : name + "." + zone;
  }

  /** Returns the record as a fully populated set of fields. */
  public RecordFields toFields() {
    return new RecordFields(name, type.name(), parameter, ttl);
  }

  @Override
  public String toString() {
    return String.format("%s %d %s %s", getFqdn(), ttl, type, parameter);
  }
}
