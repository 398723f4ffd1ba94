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

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import jakarta.inject.Inject;
import zonerelay.dns.DnsProvider;

/** Command to delete a record, identified by its name, type and parameter. */
@Parameters(separators = " =", commandDescription = "Delete a DNS record from a hosted zone")
final class RemoveRecordCommand implements Command {

  @Parameter(
      names = {"-z", "--zone"},
      description = "Zone the record belongs to",
      required = true)
  String zone;

  @Parameter(
      names = {"-n", "--name"},
      description = "Record name relative to the zone, or @ for the apex",
      required = true)
  String name;

  @Parameter(
      names = {"-t", "--type"},
      description = "Record type",
      required = true)
  String type;

  @Parameter(
      names = {"-p", "--parameter"},
      description = "Record data; needed to tell apart records sharing a name and type",
      required = true)
  String parameter;

  @Inject DnsProvider dnsProvider;

  @Override
  public void injectFrom(ZoneRelayToolComponent component) {
    component.inject(this);
  }

  @Override
  public void run() throws Exception {
    dnsProvider.removeRecord(zone, name, type, parameter);
    System.out.printf("Deleted %s record %s from zone %s%n", type, name, zone);
  }
}
