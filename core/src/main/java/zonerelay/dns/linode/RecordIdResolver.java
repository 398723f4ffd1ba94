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

import jakarta.inject.Inject;
import java.util.Optional;
import zonerelay.dns.CanonicalRecord;
import zonerelay.dns.LocalRecordCache;
import zonerelay.dns.linode.client.LinodeApiException;

/**
 * Finds the Linode id of an existing record.
 *
 * <p>A zone is listed the first time one of its records is looked up. After that, lookups are
 * answered from the {@link LocalRecordCache} alone, so records created outside this process once
 * the zone is loaded cannot be resolved until the zone is invalidated.
 */
public class RecordIdResolver {

  private final LocalRecordCache recordCache;
  private final ZoneSynthesizer zoneSynthesizer;

  @Inject
  public RecordIdResolver(LocalRecordCache recordCache, ZoneSynthesizer zoneSynthesizer) {
    this.recordCache = recordCache;
    this.zoneSynthesizer = zoneSynthesizer;
  }

  /**
   * Returns the id carried by {@code record}, or else the id of the cached record with the same
   * name, type and parameter.
   *
   * @throws LinodeApiException if the zone had to be listed and the listing failed
   */
  public Optional<Long> resolve(CanonicalRecord record) throws LinodeApiException {
    if (record.getProviderId().isPresent()) {
      return record.getProviderId();
    }
    return find(record).flatMap(CanonicalRecord::getProviderId);
  }

  /** Returns the cached record with the same name, type and parameter, loading its zone first. */
  public Optional<CanonicalRecord> find(CanonicalRecord record) throws LinodeApiException {
    if (!recordCache.isLoaded(record.zone())) {
      zoneSynthesizer.loadZone(record.zone());
    }
    return recordCache.get(record.zone(), record.getKey());
  }
}
