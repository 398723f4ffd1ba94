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

import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import zonerelay.dns.DnsProvider;

/** Unit tests for {@link DeleteZoneCommand}. */
class DeleteZoneCommandTest extends CommandTestCase<DeleteZoneCommand> {

  @Mock private DnsProvider dnsProvider;

  @BeforeEach
  void beforeEach() {
    command.dnsProvider = dnsProvider;
  }

  @Test
  void testSuccess() throws Exception {
    when(dnsProvider.removeZone("example.org")).thenReturn(true);

    runCommand("example.org");

    assertStdoutIs("Deleted zone example.org\n");
  }

  @Test
  void testSuccess_notHosted() throws Exception {
    when(dnsProvider.removeZone("example.org")).thenReturn(false);

    runCommand("example.org");

    assertStdoutIs("Zone example.org is not hosted, nothing to delete\n");
  }
}
