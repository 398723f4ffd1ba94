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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.net.HttpURLConnection;
import java.time.Duration;
import java.util.Optional;
import javax.annotation.Nullable;
import zonerelay.config.RelayConfig.Config;
import zonerelay.dns.CanonicalRecord;
import zonerelay.dns.DnsProvider;
import zonerelay.dns.DnsProviderException.InvalidRecordException;
import zonerelay.dns.DnsProviderException.ProviderRequestException;
import zonerelay.dns.DnsProviderException.RecordNotFoundException;
import zonerelay.dns.DnsProviderException.ZoneNotFoundException;
import zonerelay.dns.LocalRecordCache;
import zonerelay.dns.RecordCanonicalizer;
import zonerelay.dns.RecordFields;
import zonerelay.dns.RecordType;
import zonerelay.dns.linode.client.LinodeApiException;
import zonerelay.dns.linode.client.LinodeDomainsClient;
import zonerelay.dns.linode.client.model.LinodeDomain;
import zonerelay.dns.linode.client.model.LinodeRecord;
import zonerelay.util.Sleeper;

/**
 * {@link DnsProvider} backed by the Linode Domains API.
 *
 * <p>Mutations of existing records need the Linode record id. It is taken from the record itself
 * when known, or else from the {@link LocalRecordCache}, which is loaded by listing the zone the
 * first time one of its records is looked up. The cache is only changed after Linode confirms a
 * mutation.
 */
@Singleton
public class LinodeDnsProvider implements DnsProvider {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  public static final ImmutableSet<RecordType> PERMITTED_RECORD_TYPES =
      Sets.immutableEnumSet(
          RecordType.A,
          RecordType.AAAA,
          RecordType.CAA,
          RecordType.CNAME,
          RecordType.MX,
          RecordType.NS,
          RecordType.SRV,
          RecordType.TXT);

  /** Linode rejects a CNAME at the apex. */
  public static final boolean CNAME_APEX_RESTRICTED = true;

  private final LinodeDomainsClient domainsClient;
  private final ZoneMetadataCache zoneMetadataCache;
  private final RecordIdResolver recordIdResolver;
  private final ZoneSynthesizer zoneSynthesizer;
  private final LocalRecordCache recordCache;
  private final RecordCanonicalizer canonicalizer;
  private final Sleeper sleeper;
  private final ImmutableList<String> hostingNameservers;
  private final int zoneAuthorityPollAttempts;
  private final Duration zoneAuthorityPollInterval;

  @Inject
  public LinodeDnsProvider(
      LinodeDomainsClient domainsClient,
      ZoneMetadataCache zoneMetadataCache,
      RecordIdResolver recordIdResolver,
      ZoneSynthesizer zoneSynthesizer,
      LocalRecordCache recordCache,
      RecordCanonicalizer canonicalizer,
      Sleeper sleeper,
      @Config("dnsHostingNameservers") ImmutableList<String> hostingNameservers,
      @Config("zoneAuthorityPollAttempts") int zoneAuthorityPollAttempts,
      @Config("zoneAuthorityPollInterval") Duration zoneAuthorityPollInterval) {
    this.domainsClient = domainsClient;
    this.zoneMetadataCache = zoneMetadataCache;
    this.recordIdResolver = recordIdResolver;
    this.zoneSynthesizer = zoneSynthesizer;
    this.recordCache = recordCache;
    this.canonicalizer = canonicalizer;
    this.sleeper = sleeper;
    this.hostingNameservers = hostingNameservers;
    this.zoneAuthorityPollAttempts = zoneAuthorityPollAttempts;
    this.zoneAuthorityPollInterval = zoneAuthorityPollInterval;
  }

  @Override
  public ImmutableSet<RecordType> getPermittedRecordTypes() {
    return PERMITTED_RECORD_TYPES;
  }

  @Override
  public boolean hasCnameApexRestriction() {
    return CNAME_APEX_RESTRICTED;
  }

  @Override
  public ImmutableList<String> getHostingNameservers(String domain) {
    return hostingNameservers;
  }

  @Override
  public CanonicalRecord addRecord(
      String zone, String name, String type, String parameter, @Nullable Integer ttl)
      throws InvalidRecordException, ZoneNotFoundException, ProviderRequestException {
    CanonicalRecord record =
        canonicalizer.canonicalize(zone, RecordFields.of(name, type, parameter, ttl));
    long zoneId =
        lookupZoneId(record.zone()).orElseThrow(() -> new ZoneNotFoundException(record.zone()));
    LinodeRecord created;
    try {
      created = domainsClient.createRecord(zoneId, LinodeRecordCodec.encode(record));
    } catch (LinodeApiException e) {
      throw new ProviderRequestException(
          String.format("Failed to create record `%s': %s", record, e.renderReason()), e);
    }
    CanonicalRecord stored = record.withProviderId(created.id());
    recordCache.put(stored);
    logger.atInfo().log("Created record %s with Linode id %s", stored, created.id());
    return stored;
  }

  @Override
  public void removeRecord(String zone, String name, String type, String parameter)
      throws InvalidRecordException, RecordNotFoundException, ProviderRequestException {
    CanonicalRecord record =
        canonicalizer.canonicalize(zone, RecordFields.of(name, type, parameter));
    Optional<Long> recordId = resolveRecordId(record);
    Optional<Long> zoneId = recordId.isPresent() ? lookupZoneId(record.zone()) : Optional.empty();
    if (recordId.isEmpty() || zoneId.isEmpty()) {
      throw new RecordNotFoundException(
          String.format(
              "Record `%s' (rr: `%s', param: `%s') does not exist",
              record.getFqdn(), record.type(), record.parameter()));
    }
    int status;
    try {
      status = domainsClient.deleteRecord(zoneId.get(), recordId.get());
    } catch (LinodeApiException e) {
      throw new ProviderRequestException(
          String.format(
              "Failed to delete record `%s' type %s: %s",
              record.getFqdn(), record.type(), e.renderReason()),
          e);
    }
    if (status != HttpURLConnection.HTTP_OK) {
      throw new ProviderRequestException(
          String.format(
              "Failed to delete record `%s' type %s: Linode answered HTTP %d",
              record.getFqdn(), record.type(), status));
    }
    recordCache.remove(record.zone(), record.getKey());
    logger.atInfo().log("Deleted record %s (Linode id %d)", record, recordId.get());
  }

  @Override
  public CanonicalRecord updateRecord(String zone, RecordFields oldRecord, RecordFields patch)
      throws InvalidRecordException, RecordNotFoundException, ProviderRequestException {
    CanonicalRecord old = canonicalizer.canonicalize(zone, oldRecord);
    RecordFields canonicalPatch = canonicalizer.canonicalizePatch(zone, patch);
    CanonicalRecord merged =
        canonicalizer.canonicalize(zone, canonicalPatch.mergeOnto(old.toFields()));

    Optional<CanonicalRecord> listed = findListedRecord(old);
    Optional<Long> recordId = listed.flatMap(CanonicalRecord::getProviderId);
    Optional<Long> zoneId = recordId.isPresent() ? lookupZoneId(old.zone()) : Optional.empty();
    if (recordId.isEmpty() || zoneId.isEmpty()) {
      throw new RecordNotFoundException(
          String.format(
              "Failed to find record ID in Linode zone `%s' - does `%s' (rr: `%s', parameter:"
                  + " `%s') exist?",
              old.zone(), old.name(), old.type(), old.parameter()));
    }
    if (oldRecord.ttl() == null && patch.ttl() == null) {
      // The caller did not name a TTL, so the one Linode holds is kept.
      merged = canonicalizer.canonicalize(zone, canonicalPatch.mergeOnto(listed.get().toFields()));
    }
    CanonicalRecord updated = merged.withProviderId(recordId.get());
    try {
      domainsClient.updateRecord(zoneId.get(), recordId.get(), LinodeRecordCodec.encode(updated));
    } catch (LinodeApiException e) {
      throw new ProviderRequestException(
          String.format(
              "Failed to update record `%s' on zone `%s' (old - rr: `%s', param: `%s'; new -"
                  + " name: `%s', rr: `%s', param: `%s'): %s",
              old.name(),
              old.zone(),
              old.type(),
              old.parameter(),
              updated.name(),
              updated.type(),
              updated.parameter(),
              e.renderReason()),
          e);
    }
    recordCache.remove(old.zone(), old.getKey());
    recordCache.put(updated);
    logger.atInfo().log("Updated record %s to %s", old, updated);
    return updated;
  }

  @Override
  public void addZone(String domain) throws ProviderRequestException {
    String zone = normalizeDomain(domain);
    try {
      domainsClient.createDomain(LinodeDomain.newMasterZone(zone));
    } catch (LinodeApiException e) {
      throw new ProviderRequestException(
          String.format("Failed to add zone `%s', error: %s", zone, e.renderReason()), e);
    }
    logger.atInfo().log("Created Linode zone %s", zone);
    for (int attempt = 1; attempt <= zoneAuthorityPollAttempts; attempt++) {
      if (isZoneVisible(zone)) {
        return;
      }
      if (attempt < zoneAuthorityPollAttempts) {
        sleeper.sleepUninterruptibly(zoneAuthorityPollInterval);
      }
    }
    logger.atWarning().log(
        "Zone %s is not yet listed by Linode after %d attempts", zone, zoneAuthorityPollAttempts);
  }

  /**
   * {@inheritDoc}
   *
   * <p>The zone id stays in the {@link ZoneMetadataCache}, so re-adding the same domain in this
   * process finds the stale id at once and skips waiting for the new zone to be listed.
   */
  @Override
  public boolean removeZone(String domain) throws ProviderRequestException {
    String zone = normalizeDomain(domain);
    Optional<Long> zoneId = lookupZoneId(zone);
    if (zoneId.isEmpty()) {
      logger.atWarning().log("Domain ID not found - `%s' already removed?", zone);
      return false;
    }
    try {
      domainsClient.deleteDomain(zoneId.get());
    } catch (LinodeApiException e) {
      throw new ProviderRequestException(
          String.format("Failed to remove zone `%s', error: %s", zone, e.renderReason()), e);
    }
    recordCache.invalidateZone(zone);
    logger.atInfo().log("Removed Linode zone %s", zone);
    return true;
  }

  @Override
  public Optional<String> getZoneText(String domain) {
    return zoneSynthesizer.synthesize(normalizeDomain(domain));
  }

  private Optional<Long> lookupZoneId(String zone) throws ProviderRequestException {
    try {
      return zoneMetadataCache.getZoneId(zone);
    } catch (LinodeApiException e) {
      throw new ProviderRequestException(
          String.format("Failed to list Linode zones: %s", e.renderReason()), e);
    }
  }

  private Optional<Long> resolveRecordId(CanonicalRecord record) throws ProviderRequestException {
    try {
      return recordIdResolver.resolve(record);
    } catch (LinodeApiException e) {
      throw listingFailure(record.zone(), e);
    }
  }

  private Optional<CanonicalRecord> findListedRecord(CanonicalRecord record)
      throws ProviderRequestException {
    try {
      return recordIdResolver.find(record);
    } catch (LinodeApiException e) {
      throw listingFailure(record.zone(), e);
    }
  }

  private static ProviderRequestException listingFailure(String zone, LinodeApiException e) {
    return new ProviderRequestException(
        String.format("Failed to list records of zone `%s': %s", zone, e.renderReason()), e);
  }

  private boolean isZoneVisible(String zone) {
    try {
      return zoneMetadataCache.getZoneId(zone).isPresent();
    } catch (LinodeApiException e) {
      logger.atWarning().withCause(e).log("Failed to list Linode zones while waiting for %s", zone);
      return false;
    }
  }

  private static String normalizeDomain(String domain) {
    String zone = Ascii.toLowerCase(domain.trim());
    return zone.endsWith(".") ? zone.substring(0, zone.length() - 1) : zone;
  }
}
