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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Process-scoped cache of canonical records, keyed by zone and {@link RecordKey}.
 *
 * <p>A zone counts as loaded once its full listing has been stored with {@link #replaceZone}.
 * Not thread-safe; callers serialize access.
 */
@Singleton
public class LocalRecordCache {

  private final Table<String, RecordKey, CanonicalRecord> records = HashBasedTable.create();
  private final Set<String> loadedZones = new HashSet<>();

  @Inject
  public LocalRecordCache() {}

  public void put(CanonicalRecord record) {
    records.put(record.zone(), record.getKey(), record);
  }

  public void remove(String zone, RecordKey key) {
    records.remove(zone, key);
  }

  public Optional<CanonicalRecord> get(String zone, RecordKey key) {
    return Optional.ofNullable(records.get(zone, key));
  }

  public ImmutableList<CanonicalRecord> getRecords(String zone) {
    return ImmutableList.copyOf(records.row(zone).values());
  }

  /** Replaces every entry of {@code zone} with {@code zoneRecords} and marks the zone loaded. */
  public void replaceZone(String zone, Iterable<CanonicalRecord> zoneRecords) {
    records.row(zone).clear();
    zoneRecords.forEach(this::put);
    loadedZones.add(zone);
  }

  /** Drops every entry of {@code zone}; the next lookup will have to load it again. */
  public void invalidateZone(String zone) {
    records.row(zone).clear();
    loadedZones.remove(zone);
  }

  public boolean isLoaded(String zone) {
    return loadedZones.contains(zone);
  }
}
