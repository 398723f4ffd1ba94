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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import javax.annotation.Nullable;
import zonerelay.dns.DnsProviderException.InvalidRecordException;
import zonerelay.dns.DnsProviderException.ProviderRequestException;
import zonerelay.dns.DnsProviderException.RecordNotFoundException;
import zonerelay.dns.DnsProviderException.ZoneNotFoundException;

/**
 * A remote authoritative DNS host whose zones and records can be managed.
 *
 * <p>Record operations accept raw names, types and parameters; implementations canonicalize them
 * before any request is sent, so an {@link InvalidRecordException} never leaves remote state
 * changed.
 */
public interface DnsProvider {

  /** Record types this provider accepts. */
  ImmutableSet<RecordType> getPermittedRecordTypes();

  /** Whether a CNAME record is forbidden at the zone apex. */
  boolean hasCnameApexRestriction();

  /** Nameservers that serve {@code domain} once it is hosted here. */
  ImmutableList<String> getHostingNameservers(String domain);

  /**
   * Creates a record.
   *
   * @param ttl TTL in seconds, or null for the configured default
   * @return the stored record, carrying the identifier the provider assigned
   */
  CanonicalRecord addRecord(
      String zone, String name, String type, String parameter, @Nullable Integer ttl)
      throws InvalidRecordException, ZoneNotFoundException, ProviderRequestException;

  /** Deletes the record identified by name, type and parameter. */
  void removeRecord(String zone, String name, String type, String parameter)
      throws InvalidRecordException, RecordNotFoundException, ProviderRequestException;

  /**
   * Replaces {@code oldRecord} with {@code oldRecord} patched by {@code patch} in a single request.
   *
   * @return the record as stored after the update
   */
  CanonicalRecord updateRecord(String zone, RecordFields oldRecord, RecordFields patch)
      throws InvalidRecordException, RecordNotFoundException, ProviderRequestException;

  /** Starts hosting {@code domain}. */
  void addZone(String domain) throws ProviderRequestException;

  /**
   * Stops hosting {@code domain}.
   *
   * @return false if the provider did not host the domain
   */
  boolean removeZone(String domain) throws ProviderRequestException;

  /** Renders the zone as AXFR-style text, or empty if it cannot be read. */
  Optional<String> getZoneText(String domain);
}
