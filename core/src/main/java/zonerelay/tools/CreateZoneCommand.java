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
import com.google.common.base.Joiner;
import jakarta.inject.Inject;
import java.util.List;
import zonerelay.dns.DnsProvider;

/** Command to start hosting a domain. */
@Parameters(separators = " =", commandDescription = "Create a zone on the DNS provider")
final class CreateZoneCommand implements Command {

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
    dnsProvider.addZone(domain);
    System.out.printf(
        "Created zone %s, delegate it to: %s%n",
        domain, Joiner.on(", ").join(dnsProvider.getHostingNameservers(domain)));
  }
}
