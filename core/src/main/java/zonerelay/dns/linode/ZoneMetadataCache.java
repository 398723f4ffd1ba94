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

import com.google.common.base.Ascii;
import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import zonerelay.dns.linode.client.LinodeApiException;
import zonerelay.dns.linode.client.LinodeDomainsClient;
import zonerelay.dns.linode.client.model.LinodeDomain;
import zonerelay.dns.linode.client.model.Page;

/**
 * Zone metadata owned by the API credential, keyed by lower-cased domain name.
 *
 * <p>Populated lazily: a lookup that misses lists every page of zones and merges the result into
 * the cache. Entries are never evicted individually, so a found domain never triggers another
 * listing. Not thread-safe.
 */
@Singleton
public class ZoneMetadataCache {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final LinodeDomainsClient domainsClient;
  private final Map<String, LinodeDomain> zones = new HashMap<>();

  @Inject
  public ZoneMetadataCache(LinodeDomainsClient domainsClient) {
    this.domainsClient = domainsClient;
  }

  /** Returns the Linode id of {@code domain}, or empty if the credential does not own it. */
  public Optional<Long> getZoneId(String domain) throws LinodeApiException {
    return getZoneMetadata(domain).map(LinodeDomain::id);
  }

  public Optional<LinodeDomain> getZoneMetadata(String domain) throws LinodeApiException {
    String key = Ascii.toLowerCase(domain);
    if (!zones.containsKey(key)) {
      populate();
    }
    return Optional.ofNullable(zones.get(key));
  }

  /** Lists every page of zones and merges them into the cache once the listing completes. */
  private void populate() throws LinodeApiException {
    Map<String, LinodeDomain> accumulator = new HashMap<>();
    int pageNumber = 1;
    Page<LinodeDomain> page;
    do {
      page = domainsClient.listDomains(pageNumber++);
      for (LinodeDomain domain : page.data()) {
        accumulator.put(Ascii.toLowerCase(domain.domain()), domain);
      }
    } while (page.hasMorePages());
    zones.putAll(accumulator);
    logger.atInfo().log("Loaded metadata for %d Linode zones", accumulator.size());
  }
}
