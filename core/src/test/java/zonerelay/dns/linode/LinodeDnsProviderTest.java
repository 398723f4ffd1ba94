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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import zonerelay.dns.CanonicalRecord;
import zonerelay.dns.DefaultRecordCanonicalizer;
import zonerelay.dns.DnsProviderException.InvalidRecordException;
import zonerelay.dns.DnsProviderException.ProviderRequestException;
import zonerelay.dns.DnsProviderException.RecordNotFoundException;
import zonerelay.dns.DnsProviderException.ZoneNotFoundException;
import zonerelay.dns.LocalRecordCache;
import zonerelay.dns.RecordFields;
import zonerelay.dns.RecordKey;
import zonerelay.dns.RecordPolicy;
import zonerelay.dns.RecordType;
import zonerelay.dns.SoaLookup;
import zonerelay.dns.linode.client.LinodeApiException;
import zonerelay.dns.linode.client.LinodeDomainsClient;
import zonerelay.dns.linode.client.model.LinodeDomain;
import zonerelay.dns.linode.client.model.LinodeErrorResponse;
import zonerelay.dns.linode.client.model.LinodeErrorResponse.ApiError;
import zonerelay.dns.linode.client.model.LinodeRecord;
import zonerelay.dns.linode.client.model.Page;
import zonerelay.testing.FakeSleeper;

/** Unit tests for {@link LinodeDnsProvider}. */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LinodeDnsProviderTest {

  private static final ImmutableList<String> NAMESERVERS =
      ImmutableList.of("ns1.linode.com", "ns2.linode.com");
  private static final long ZONE_ID = 12L;
  private static final LinodeDomain EXAMPLE_COM =
      new LinodeDomain(ZONE_ID, "example.com", "master", "active", "hostmaster@example.com");

  @Mock private LinodeDomainsClient domainsClient;
  @Mock private SoaLookup soaLookup;

  private final LocalRecordCache recordCache = new LocalRecordCache();
  private final FakeSleeper sleeper = new FakeSleeper();
  private LinodeDnsProvider provider;

  @BeforeEach
  void beforeEach() throws Exception {
    ZoneMetadataCache zoneMetadataCache = new ZoneMetadataCache(domainsClient);
    ZoneSynthesizer synthesizer =
        new ZoneSynthesizer(
            zoneMetadataCache, domainsClient, soaLookup, recordCache, NAMESERVERS, 1800);
    provider =
        new LinodeDnsProvider(
            domainsClient,
            zoneMetadataCache,
            new RecordIdResolver(recordCache, synthesizer),
            synthesizer,
            recordCache,
            new DefaultRecordCanonicalizer(
                new RecordPolicy(LinodeDnsProvider.PERMITTED_RECORD_TYPES, true, 1800)),
            sleeper,
            NAMESERVERS,
            10,
            Duration.ofSeconds(1));
    when(domainsClient.listDomains(1)).thenReturn(domainsPage(EXAMPLE_COM));
  }

  private static Page<LinodeDomain> domainsPage(LinodeDomain... domains) {
    return new Page<>(ImmutableList.copyOf(domains), 1, 1, domains.length);
  }

  private static LinodeRecord listedA(long id, String name, String address, int ttl) {
    return LinodeRecord.builder("A")
        .setId(id)
        .setName(name)
        .setTarget(address)
        .setTtlSec(ttl)
        .build();
  }

  private static LinodeApiException badRequest(String reason) {
    return new LinodeApiException(
        "Linode returned HTTP 400",
        400,
        "",
        new LinodeErrorResponse(ImmutableList.of(new ApiError("target", reason))));
  }

  @Test
  void testCapabilities() {
    assertThat(provider.getPermittedRecordTypes()).doesNotContain(RecordType.PTR);
    assertThat(provider.hasCnameApexRestriction()).isTrue();
    assertThat(provider.getHostingNameservers("example.com")).isEqualTo(NAMESERVERS);
  }

  @Test
  void testAddRecord_postsEncodedRecordAndCachesIt() throws Exception {
    when(domainsClient.createRecord(eq(ZONE_ID), any(LinodeRecord.class)))
        .thenReturn(listedA(501, "www", "203.0.113.5", 3600));

    CanonicalRecord stored = provider.addRecord("example.com", "www", "A", "203.0.113.5", 3600);

    ArgumentCaptor<LinodeRecord> body = ArgumentCaptor.forClass(LinodeRecord.class);
    verify(domainsClient).createRecord(eq(ZONE_ID), body.capture());
    assertThat(body.getValue())
        .isEqualTo(
            LinodeRecord.builder("A")
                .setName("www")
                .setTarget("203.0.113.5")
                .setTtlSec(3600)
                .build());
    assertThat(stored.getProviderId()).hasValue(501L);
    assertThat(recordCache.get("example.com", new RecordKey("www", RecordType.A, "203.0.113.5")))
        .hasValue(stored);
  }

  @Test
  void testAddRecord_unknownZone() throws Exception {
    ZoneNotFoundException thrown =
        assertThrows(
            ZoneNotFoundException.class,
            () -> provider.addRecord("example.net", "www", "A", "203.0.113.5", null));
    assertThat(thrown).hasMessageThat().isEqualTo("Zone `example.net' not found on provider");
    verify(domainsClient, never()).createRecord(anyLong(), any(LinodeRecord.class));
  }

  @Test
  void testAddRecord_invalidRecordSendsNothing() {
    assertThrows(
        InvalidRecordException.class,
        () -> provider.addRecord("example.com", "www", "A", "not-an-address", null));
    verifyNoInteractions(domainsClient);
  }

  @Test
  void testAddRecord_apiFailureLeavesCacheUntouched() throws Exception {
    when(domainsClient.createRecord(eq(ZONE_ID), any(LinodeRecord.class)))
        .thenThrow(badRequest("Target must be a valid IPv4 address"));

    ProviderRequestException thrown =
        assertThrows(
            ProviderRequestException.class,
            () -> provider.addRecord("example.com", "www", "A", "203.0.113.5", null));

    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo(
            "Failed to create record `www.example.com 1800 A 203.0.113.5': "
                + "Target must be a valid IPv4 address");
    assertThat(recordCache.getRecords("example.com")).isEmpty();
  }

  @Test
  void testUpdateRecord_patchKeepsUnsetFields() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(77, "www", "203.0.113.5", 3600)));

    CanonicalRecord updated =
        provider.updateRecord(
            "example.com",
            RecordFields.of("www", "A", "203.0.113.5", 3600),
            RecordFields.of(null, null, "203.0.113.9"));

    ArgumentCaptor<LinodeRecord> body = ArgumentCaptor.forClass(LinodeRecord.class);
    verify(domainsClient).updateRecord(eq(ZONE_ID), eq(77L), body.capture());
    assertThat(body.getValue().target()).isEqualTo("203.0.113.9");
    assertThat(body.getValue().ttlSec()).isEqualTo(3600);
    assertThat(updated.getProviderId()).hasValue(77L);
    assertThat(recordCache.get("example.com", new RecordKey("www", RecordType.A, "203.0.113.5")))
        .isEmpty();
    assertThat(recordCache.get("example.com", new RecordKey("www", RecordType.A, "203.0.113.9")))
        .hasValue(updated);
  }

  @Test
  void testUpdateRecord_ttlOnly() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(77, "www", "203.0.113.5", 3600)));

    provider.updateRecord(
        "example.com", RecordFields.of("www", "A", "203.0.113.5"), RecordFields.ttlOnly(60));

    ArgumentCaptor<LinodeRecord> body = ArgumentCaptor.forClass(LinodeRecord.class);
    verify(domainsClient).updateRecord(eq(ZONE_ID), eq(77L), body.capture());
    assertThat(body.getValue())
        .isEqualTo(
            LinodeRecord.builder("A")
                .setName("www")
                .setTarget("203.0.113.5")
                .setTtlSec(60)
                .build());
  }

  @Test
  void testUpdateRecord_keepsListedTtlWhenNoneGiven() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(77, "www", "203.0.113.5", 3600)));

    CanonicalRecord updated =
        provider.updateRecord(
            "example.com",
            RecordFields.of("www", "A", "203.0.113.5"),
            RecordFields.of(null, null, "203.0.113.9"));

    ArgumentCaptor<LinodeRecord> body = ArgumentCaptor.forClass(LinodeRecord.class);
    verify(domainsClient).updateRecord(eq(ZONE_ID), eq(77L), body.capture());
    assertThat(body.getValue().ttlSec()).isEqualTo(3600);
    assertThat(updated.ttl()).isEqualTo(3600);
  }

  @Test
  void testUpdateRecord_listingFailure() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID)).thenThrow(badRequest("Service unavailable"));

    ProviderRequestException thrown =
        assertThrows(
            ProviderRequestException.class,
            () ->
                provider.updateRecord(
                    "example.com",
                    RecordFields.of("www", "A", "203.0.113.5"),
                    RecordFields.ttlOnly(60)));

    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo("Failed to list records of zone `example.com': Service unavailable");
    verify(domainsClient, never()).updateRecord(anyLong(), anyLong(), any(LinodeRecord.class));
  }

  @Test
  void testUpdateRecord_invalidPatchSendsNothing() throws Exception {
    assertThrows(
        InvalidRecordException.class,
        () ->
            provider.updateRecord(
                "example.com",
                RecordFields.of("www", "A", "203.0.113.5"),
                RecordFields.of(null, "BOGUS", null)));
    verifyNoInteractions(domainsClient);
  }

  @Test
  void testUpdateRecord_missingRecord() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID)).thenReturn(ImmutableList.of());

    RecordNotFoundException thrown =
        assertThrows(
            RecordNotFoundException.class,
            () ->
                provider.updateRecord(
                    "example.com",
                    RecordFields.of("www", "A", "203.0.113.5"),
                    RecordFields.ttlOnly(60)));

    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo(
            "Failed to find record ID in Linode zone `example.com' - does `www' (rr: `A',"
                + " parameter: `203.0.113.5') exist?");
    verify(domainsClient, never()).updateRecord(anyLong(), anyLong(), any(LinodeRecord.class));
  }

  @Test
  void testUpdateRecord_apiFailureLeavesCacheUntouched() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(77, "www", "203.0.113.5", 3600)));
    when(domainsClient.updateRecord(eq(ZONE_ID), eq(77L), any(LinodeRecord.class)))
        .thenThrow(badRequest("Invalid target"));

    ProviderRequestException thrown =
        assertThrows(
            ProviderRequestException.class,
            () ->
                provider.updateRecord(
                    "example.com",
                    RecordFields.of("www", "A", "203.0.113.5"),
                    RecordFields.of("web", null, "203.0.113.9")));

    assertThat(thrown).hasMessageThat().contains("old - rr: `A', param: `203.0.113.5'");
    assertThat(thrown)
        .hasMessageThat()
        .contains("new - name: `web', rr: `A', param: `203.0.113.9'");
    assertThat(thrown).hasMessageThat().endsWith("Invalid target");
    assertThat(recordCache.get("example.com", new RecordKey("www", RecordType.A, "203.0.113.5")))
        .isPresent();
    assertThat(recordCache.get("example.com", new RecordKey("web", RecordType.A, "203.0.113.9")))
        .isEmpty();
  }

  @Test
  void testRemoveRecord_deletesAndEvicts() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(77, "www", "203.0.113.5", 3600)));
    when(domainsClient.deleteRecord(ZONE_ID, 77L)).thenReturn(200);

    provider.removeRecord("example.com", "WWW", "a", "203.0.113.5");

    verify(domainsClient).deleteRecord(ZONE_ID, 77L);
    assertThat(recordCache.getRecords("example.com")).isEmpty();
  }

  @Test
  void testRemoveRecord_unresolvableRecordIsNotDeleted() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(77, "www", "203.0.113.5", 3600)));

    RecordNotFoundException thrown =
        assertThrows(
            RecordNotFoundException.class,
            () -> provider.removeRecord("example.com", "www", "A", "203.0.113.6"));

    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo(
            "Record `www.example.com' (rr: `A', param: `203.0.113.6') does not exist");
    verify(domainsClient, never()).deleteRecord(anyLong(), anyLong());
  }

  @Test
  void testRemoveRecord_listingFailure() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID)).thenThrow(badRequest("Service unavailable"));

    ProviderRequestException thrown =
        assertThrows(
            ProviderRequestException.class,
            () -> provider.removeRecord("example.com", "www", "A", "203.0.113.5"));

    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo("Failed to list records of zone `example.com': Service unavailable");
    assertThat(recordCache.isLoaded("example.com")).isFalse();
    verify(domainsClient, never()).deleteRecord(anyLong(), anyLong());
  }

  @Test
  void testRemoveRecord_nonOkStatusIsFailure() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(77, "www", "203.0.113.5", 3600)));
    when(domainsClient.deleteRecord(ZONE_ID, 77L)).thenReturn(204);

    ProviderRequestException thrown =
        assertThrows(
            ProviderRequestException.class,
            () -> provider.removeRecord("example.com", "www", "A", "203.0.113.5"));

    assertThat(thrown).hasMessageThat().endsWith("Linode answered HTTP 204");
    assertThat(recordCache.getRecords("example.com")).hasSize(1);
  }

  @Test
  void testRemoveRecord_usesCachedIdWithoutRelisting() throws Exception {
    when(domainsClient.createRecord(eq(ZONE_ID), any(LinodeRecord.class)))
        .thenReturn(listedA(501, "www", "203.0.113.5", 3600));
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(501, "www", "203.0.113.5", 3600)));
    when(domainsClient.deleteRecord(ZONE_ID, 501L)).thenReturn(200);

    provider.getZoneText("example.com");
    provider.removeRecord("example.com", "www", "A", "203.0.113.5");
    provider.addRecord("example.com", "www", "A", "203.0.113.5", 3600);
    provider.removeRecord("example.com", "www", "A", "203.0.113.5");

    verify(domainsClient, times(1)).listAllRecords(ZONE_ID);
    verify(domainsClient, times(2)).deleteRecord(ZONE_ID, 501L);
  }

  @Test
  void testAddZone_pollsUntilVisible() throws Exception {
    LinodeDomain created = new LinodeDomain(40L, "example.org", "master", "active", null);
    when(domainsClient.createDomain(LinodeDomain.newMasterZone("example.org")))
        .thenReturn(created);
    when(domainsClient.listDomains(1))
        .thenReturn(domainsPage(EXAMPLE_COM))
        .thenReturn(domainsPage(EXAMPLE_COM))
        .thenReturn(domainsPage(EXAMPLE_COM, created));

    provider.addZone("Example.org.");

    verify(domainsClient, times(3)).listDomains(1);
    assertThat(sleeper.getSleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
  }

  @Test
  void testAddZone_givesUpAfterConfiguredAttempts() throws Exception {
    when(domainsClient.createDomain(any(LinodeDomain.class)))
        .thenReturn(new LinodeDomain(40L, "example.org", "master", "active", null));

    provider.addZone("example.org");

    verify(domainsClient, times(10)).listDomains(1);
    assertThat(sleeper.getSleeps()).isEqualTo(Collections.nCopies(9, Duration.ofSeconds(1)));
  }

  @Test
  void testAddZone_listingFailuresAreNotFatal() throws Exception {
    when(domainsClient.createDomain(any(LinodeDomain.class)))
        .thenReturn(new LinodeDomain(40L, "example.org", "master", "active", null));
    when(domainsClient.listDomains(1)).thenThrow(badRequest("busy"));

    provider.addZone("example.org");

    assertThat(sleeper.getSleeps()).hasSize(9);
  }

  @Test
  void testAddZone_creationFailure() throws Exception {
    when(domainsClient.createDomain(any(LinodeDomain.class)))
        .thenThrow(badRequest("Domain already exists"));

    ProviderRequestException thrown =
        assertThrows(ProviderRequestException.class, () -> provider.addZone("example.com"));

    assertThat(thrown)
        .hasMessageThat()
        .isEqualTo("Failed to add zone `example.com', error: Domain already exists");
    assertThat(sleeper.getSleeps()).isEmpty();
  }

  @Test
  void testRemoveZone() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(77, "www", "203.0.113.5", 3600)));
    provider.getZoneText("example.com");
    assertThat(recordCache.isLoaded("example.com")).isTrue();

    assertThat(provider.removeZone("example.com")).isTrue();

    verify(domainsClient).deleteDomain(ZONE_ID);
    assertThat(recordCache.isLoaded("example.com")).isFalse();
  }

  @Test
  void testRemoveZone_keepsZoneIdForLaterAdd() throws Exception {
    when(domainsClient.createDomain(any(LinodeDomain.class))).thenReturn(EXAMPLE_COM);

    assertThat(provider.removeZone("example.com")).isTrue();
    provider.addZone("example.com");

    verify(domainsClient, times(1)).listDomains(1);
    assertThat(sleeper.getSleeps()).isEmpty();
  }

  @Test
  void testRemoveZone_notHosted() throws Exception {
    assertThat(provider.removeZone("example.net")).isFalse();
    verify(domainsClient, never()).deleteDomain(anyLong());
  }

  @Test
  void testGetZoneText() throws Exception {
    when(domainsClient.listAllRecords(ZONE_ID))
        .thenReturn(ImmutableList.of(listedA(77, "www", "203.0.113.5", 3600)));

    assertThat(provider.getZoneText("EXAMPLE.COM."))
        .hasValue(
            "example.com.\t1800\tIN\tNS\tns1.linode.com.\n"
                + "example.com.\t1800\tIN\tNS\tns2.linode.com.\n"
                + "www.example.com.\t3600\tIN\tA\t203.0.113.5");
  }
}
