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
import zonerelay.dns.CanonicalRecord;
import zonerelay.dns.DnsProvider;
import zonerelay.dns.DnsProviderException.InvalidRecordException;
import zonerelay.dns.RecordFields;

/**
 * Command to change an existing record in place.
 *
 * <p>The record is identified by {@code --name}, {@code --type} and {@code --parameter}; the
 * {@code --new_*} flags name the fields to change. Fields without a flag keep their value.
 */
@Parameters(separators = " =", commandDescription = "Update a DNS record in a hosted zone")
final class UpdateRecordCommand implements Command {

  @Parameter(
      names = {"-z", "--zone"},
      description = "Zone the record belongs to",
      required = true)
  String zone;

  @Parameter(
      names = {"-n", "--name"},
      description = "Current record name",
      required = true)
  String name;

  @Parameter(
      names = {"-t", "--type"},
      description = "Current record type",
      required = true)
  String type;

  @Parameter(
      names = {"-p", "--parameter"},
      description = "Current record data",
      required = true)
  String parameter;

  @Parameter(names = "--new_name", description = "New record name")
  String newName;

  @Parameter(names = "--new_type", description = "New record type")
  String newType;

  @Parameter(names = "--new_parameter", description = "New record data")
  String newParameter;

  @Parameter(names = "--new_ttl", description = "New TTL in seconds")
  Integer newTtl;

  @Inject DnsProvider dnsProvider;

  @Override
  public void injectFrom(ZoneRelayToolComponent component) {
    component.inject(this);
  }

  @Override
  public void run() throws Exception {
    RecordFields patch = RecordFields.of(newName, newType, newParameter, newTtl);
    if (patch.isEmpty()) {
      throw new InvalidRecordException(
          "Nothing to update: set at least one of --new_name, --new_type, --new_parameter or"
              + " --new_ttl");
    }
    CanonicalRecord updated =
        dnsProvider.updateRecord(zone, RecordFields.of(name, type, parameter), patch);
    System.out.printf("Updated record %s%n", updated);
  }
}
