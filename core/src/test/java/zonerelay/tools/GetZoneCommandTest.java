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

package zonerelay.tools;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import zonerelay.dns.DnsProvider;
import zonerelay.dns.DnsProviderException.ZoneNotFoundException;

/** Unit tests for {@link GetZoneCommand}. */
class GetZoneCommandTest extends CommandTestCase<GetZoneCommand> {

  @Mock private DnsProvider dnsProvider;

  @BeforeEach
  void beforeEach() {
    command.dnsProvider = dnsProvider;
  }

  @Test
  void testSuccess() throws Exception {
    when(dnsProvider.getZoneText("example.com"))
        .thenReturn(Optional.of("www.example.com.\t300\tIN\tA\t192.0.2.1"));

    runCommand("example.com");

    assertStdoutIs("www.example.com.\t300\tIN\tA\t192.0.2.1\n");
  }

  @Test
  void testFailure_zoneNotFound() {
    when(dnsProvider.getZoneText("example.net")).thenReturn(Optional.empty());

    assertThrows(ZoneNotFoundException.class, () -> runCommand("example.net"));
  }
}
