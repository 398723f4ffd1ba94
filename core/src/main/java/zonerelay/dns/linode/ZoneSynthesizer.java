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
import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.Ints;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Optional;
import zonerelay.config.RelayConfig.Config;
import zonerelay.dns.CanonicalRecord;
import zonerelay.dns.LocalRecordCache;
import zonerelay.dns.SoaLookup;
import zonerelay.dns.linode.client.LinodeApiException;
import zonerelay.dns.linode.client.LinodeApiException.LinodeAuthorizationException;
import zonerelay.dns.linode.client.LinodeDomainsClient;
import zonerelay.dns.linode.client.model.LinodeRecord;
import zonerelay.util.StopwatchLogger;

/**
 * Renders a Linode zone as AXFR-style text and reloads the zone into the {@link LocalRecordCache}.
 *
 * <p>Linode does not serve zone transfers, so the SOA comes from the hosting nameservers and the
 * rest from the records listing. Lines are tab-separated {@code owner ttl IN type rdata}, owner
 * names fully qualified with a trailing dot.
 */
@Singleton
public class ZoneSynthesizer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Splitter SOA_FIELD_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final int SOA_MINIMUM_FIELD = 6;

  private final ZoneMetadataCache zoneMetadataCache;
  private final LinodeDomainsClient domainsClient;
  private final SoaLookup soaLookup;
  private final LocalRecordCache recordCache;
  private final ImmutableList<String> hostingNameservers;
  private final int defaultTtl;

  @Inject
  public ZoneSynthesizer(
      ZoneMetadataCache zoneMetadataCache,
      LinodeDomainsClient domainsClient,
      SoaLookup soaLookup,
      LocalRecordCache recordCache,
      @Config("dnsHostingNameservers") ImmutableList<String> hostingNameservers,
      @Config("dnsDefaultTtl") int defaultTtl) {
    this.zoneMetadataCache = zoneMetadataCache;
    this.domainsClient = domainsClient;
    this.soaLookup = soaLookup;
    this.recordCache = recordCache;
    this.hostingNameservers = hostingNameservers;
    this.defaultTtl = defaultTtl;
  }

  /**
   * Returns the zone text of {@code domain}.
   *
   * <p>Empty if Linode does not host the domain, the zone has no records, or the listing failed.
   * None of these raise; transport failures are logged.
   */
  public Optional<String> synthesize(String domain) {
    String zone = Ascii.toLowerCase(domain);
    Optional<LoadedZone> loaded;
    try {
      loaded = loadZone(zone);
    } catch (LinodeAuthorizationException e) {
      // Linode answers 401 for zones the credential cannot see.
      logger.atInfo().log("Linode denied access to zone %s, treating it as nonexistent", zone);
      return Optional.empty();
    } catch (LinodeApiException e) {
      logger.atWarning().withCause(e).log(
          "Failed to transfer DNS records of %s from Linode - try again later. Response code: %s",
          zone, e.getStatusCode().isPresent() ? e.getStatusCode().getAsInt() : "none");
      return Optional.empty();
    }
    if (loaded.isEmpty() || loaded.get().records().isEmpty()) {
      return Optional.empty();
    }

    LoadedZone loadedZone = loaded.get();
    int zoneTtl = loadedZone.zoneTtl();
    ImmutableList.Builder<String> lines = new ImmutableList.Builder<>();
    loadedZone
        .soa()
        .ifPresent(
            rdata -> lines.add(String.format("%s.\t%d\tIN\tSOA\t%s", zone, zoneTtl, rdata)));
    for (String nameserver : hostingNameservers) {
      lines.add(String.format("%s.\t%d\tIN\tNS\t%s.", zone, zoneTtl, nameserver));
    }
    for (LinodeRecord record : loadedZone.records()) {
      lines.add(
          String.format(
              "%s.\t%d\tIN\t%s\t%s",
              ownerName(record, zone),
              record.ttlSec() == null ? 0 : record.ttlSec(),
              record.type(),
              LinodeRecordCodec.decodeParameter(record)));
    }
    return Optional.of(Joiner.on('\n').join(lines.build()));
  }

  /**
   * Lists the records of {@code zone} and replaces its entries in the {@link LocalRecordCache}.
   *
   * <p>Empty if Linode does not host the zone. A zone without records is still marked loaded.
   *
   * @throws LinodeApiException if the zone or record listing fails, in which case the cache is
   *     left unchanged
   */
  public Optional<LoadedZone> loadZone(String zone) throws LinodeApiException {
    StopwatchLogger stopwatch = new StopwatchLogger("Loading zone " + zone);
    Optional<Long> zoneId = zoneMetadataCache.getZoneId(zone);
    stopwatch.tick("zone id lookup");
    if (zoneId.isEmpty()) {
      return Optional.empty();
    }
    ImmutableList<LinodeRecord> records = domainsClient.listAllRecords(zoneId.get());
    stopwatch.tick("record listing");
    if (records.isEmpty()) {
      recordCache.replaceZone(zone, ImmutableList.of());
      return Optional.of(new LoadedZone(records, Optional.empty(), defaultTtl));
    }

    Optional<String> soa = soaLookup.lookupSoa(zone, hostingNameservers);
    stopwatch.tick("SOA lookup");
    int zoneTtl = soa.map(this::soaDefaultTtl).orElse(defaultTtl);
    ImmutableList.Builder<CanonicalRecord> decoded = new ImmutableList.Builder<>();
    for (LinodeRecord record : records) {
      LinodeRecordCodec.decode(record, zone, zoneTtl).ifPresent(decoded::add);
    }
    recordCache.replaceZone(zone, decoded.build());
    return Optional.of(new LoadedZone(records, soa, zoneTtl));
  }

  /** Returns the SOA minimum field, the zone's default TTL, or the configured default. */
  private int soaDefaultTtl(String soaRdata) {
    List<String> fields = SOA_FIELD_SPLITTER.splitToList(soaRdata);
    if (fields.size() <= SOA_MINIMUM_FIELD) {
      return defaultTtl;
    }
    Integer minimum = Ints.tryParse(fields.get(SOA_MINIMUM_FIELD));
    return minimum == null ? defaultTtl : minimum;
  }

  private static String ownerName(LinodeRecord record, String zone) {
    String name = Strings.nullToEmpty(record.name());
    return name.isEmpty() ? zone : name + "." + zone;
  }

  /** Records of a zone as listed by Linode, with the SOA and TTL used to decode them. */
  public record LoadedZone(
      ImmutableList<LinodeRecord> records, Optional<String> soa, int zoneTtl) {}
}
