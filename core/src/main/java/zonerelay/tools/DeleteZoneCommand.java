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

import static com.google.common.collect.Iterables.getOnlyElement;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import jakarta.inject.Inject;
import java.util.List;
import zonerelay.dns.DnsProvider;

/** Command to stop hosting a domain. Deleting a zone that is not hosted is not an error. */
@Parameters(separators = " =", commandDescription = "Delete a zone from the DNS provider")
final class DeleteZoneCommand implements Command {

  @Parameter(description = "<domain>", required = true)
  List<String> mainParameters;

  @Inject DnsProvider dnsProvider;

  @Override
  public void injectFrom(ZoneRelayToolComponent component) {
    component.inject(this);
  }

  @Override
  public void run() throws Exception {
    String domain = getOnlyElement(mainParameters);
    if (dnsProvider.removeZone(domain)) {
      System.out.printf("Deleted zone %s%n", domain);
    } else {
      System.out.printf("Zone %s is not hosted, nothing to delete%n", domain);
    }
  }
}
