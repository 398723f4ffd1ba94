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
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import zonerelay.dns.CanonicalRecord;
import zonerelay.dns.LocalRecordCache;
import zonerelay.dns.RecordKey;
import zonerelay.dns.RecordType;
import zonerelay.dns.SoaLookup;
import zonerelay.dns.linode.client.LinodeApiException;
import zonerelay.dns.linode.client.LinodeApiException.LinodeAuthorizationException;
import zonerelay.dns.linode.client.LinodeDomainsClient;
import zonerelay.dns.linode.client.model.LinodeRecord;

/** Unit tests for {@link ZoneSynthesizer}. */
@ExtendWith(MockitoExtension.class)
class ZoneSynthesizerTest {

  private static final ImmutableList<String> NAMESERVERS =
      ImmutableList.of("ns1.linode.com", "ns2.linode.com");
  private static final String SOA =
      "ns1.linode.com. hostmaster.example.com. 2025010101 14400 14400 1209600 3600";

  @Mock private ZoneMetadataCache zoneMetadataCache;
  @Mock private LinodeDomainsClient domainsClient;
  @Mock private SoaLookup soaLookup;

  private final LocalRecordCache recordCache = new LocalRecordCache();
  private ZoneSynthesizer synthesizer;

  @BeforeEach
  void beforeEach() {
    synthesizer =
        new ZoneSynthesizer(
            zoneMetadataCache, domainsClient, soaLookup, recordCache, NAMESERVERS, 1800);
  }

  @Test
  void testSynthesize_rendersSoaNameserversAndRecords() throws Exception {
    when(zoneMetadataCache.getZoneId("example.com")).thenReturn(Optional.of(12L));
    when(domainsClient.listAllRecords(12))
        .thenReturn(
            ImmutableList.of(
                LinodeRecord.builder("A")
                    .setId(1L)
                    .setName("www")
                    .setTarget("192.0.2.1")
                    .setTtlSec(300)
                    .build(),
                LinodeRecord.builder("MX")
                    .setId(2L)
                    .setName("")
                    .setPriority(10)
                    .setTarget("mail.example.com")
                    .setTtlSec(0)
                    .build()));
    when(soaLookup.lookupSoa("example.com", NAMESERVERS)).thenReturn(Optional.of(SOA));

    Optional<String> zoneText = synthesizer.synthesize("Example.com");

    assertThat(zoneText)
        .hasValue(
            "example.com.\t3600\tIN\tSOA\t"
                + SOA
                + "\n"
                + "example.com.\t3600\tIN\tNS\tns1.linode.com.\n"
                + "example.com.\t3600\tIN\tNS\tns2.linode.com.\n"
                + "www.example.com.\t300\tIN\tA\t192.0.2.1\n"
                + "example.com.\t0\tIN\tMX\t10 mail.example.com");
    assertThat(recordCache.isLoaded("example.com")).isTrue();
    Optional<CanonicalRecord> mx =
        recordCache.get("example.com", new RecordKey("", RecordType.MX, "10 mail.example.com"));
    assertThat(mx.get().getProviderId()).hasValue(2L);
    assertThat(mx.get().ttl()).isEqualTo(3600);
  }

  @Test
  void testSynthesize_withoutSoaUsesConfiguredTtl() throws Exception {
    when(zoneMetadataCache.getZoneId("example.com")).thenReturn(Optional.of(12L));
    when(domainsClient.listAllRecords(12))
        .thenReturn(
            ImmutableList.of(
                LinodeRecord.builder("TXT").setId(3L).setName("").setTarget("hello").build()));
    when(soaLookup.lookupSoa("example.com", NAMESERVERS)).thenReturn(Optional.empty());

    assertThat(synthesizer.synthesize("example.com"))
        .hasValue(
            "example.com.\t1800\tIN\tNS\tns1.linode.com.\n"
                + "example.com.\t1800\tIN\tNS\tns2.linode.com.\n"
                + "example.com.\t0\tIN\tTXT\thello");
  }

  @Test
  void testSynthesize_unknownZone() throws Exception {
    when(zoneMetadataCache.getZoneId("example.net")).thenReturn(Optional.empty());

    assertThat(synthesizer.synthesize("example.net")).isEmpty();
    verifyNoInteractions(domainsClient, soaLookup);
  }

  @Test
  void testSynthesize_emptyListingMarksZoneLoaded() throws Exception {
    when(zoneMetadataCache.getZoneId("example.com")).thenReturn(Optional.of(12L));
    when(domainsClient.listAllRecords(12)).thenReturn(ImmutableList.of());

    assertThat(synthesizer.synthesize("example.com")).isEmpty();
    assertThat(recordCache.isLoaded("example.com")).isTrue();
    verifyNoInteractions(soaLookup);
  }

  @Test
  void testSynthesize_unauthorizedIsTreatedAsMissing() throws Exception {
    when(zoneMetadataCache.getZoneId("example.com")).thenReturn(Optional.of(12L));
    when(domainsClient.listAllRecords(12))
        .thenThrow(new LinodeAuthorizationException("denied", "", null));

    assertThat(synthesizer.synthesize("example.com")).isEmpty();
    assertThat(recordCache.isLoaded("example.com")).isFalse();
  }

  @Test
  void testSynthesize_apiFailureReturnsEmpty() throws Exception {
    when(zoneMetadataCache.getZoneId("example.com"))
        .thenThrow(new LinodeApiException("boom", new IOException("reset")));

    assertThat(synthesizer.synthesize("example.com")).isEmpty();
    assertThat(recordCache.isLoaded("example.com")).isFalse();
  }

  @Test
  void testLoadZone_listingFailurePropagates() throws Exception {
    when(zoneMetadataCache.getZoneId("example.com")).thenReturn(Optional.of(12L));
    when(domainsClient.listAllRecords(12))
        .thenThrow(new LinodeApiException("Linode returned HTTP 503", 503, "", null));

    LinodeApiException thrown =
        assertThrows(LinodeApiException.class, () -> synthesizer.loadZone("example.com"));

    assertThat(thrown.getStatusCode().getAsInt()).isEqualTo(503);
    assertThat(recordCache.isLoaded("example.com")).isFalse();
    verifyNoInteractions(soaLookup);
  }
}
