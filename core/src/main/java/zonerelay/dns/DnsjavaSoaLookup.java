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

package zonerelay.dns;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import jakarta.inject.Inject;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.Name;
import org.xbill.DNS.Record;
import org.xbill.DNS.Type;
import zonerelay.config.RelayConfig.Config;

/** {@link SoaLookup} that queries the given nameservers directly with dnsjava. */
public class DnsjavaSoaLookup implements SoaLookup {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Duration timeout;

  @Inject
  public DnsjavaSoaLookup(@Config("soaLookupTimeout") Duration timeout) {
    this.timeout = timeout;
  }

  @Override
  public Optional<String> lookupSoa(String domain, ImmutableList<String> nameservers) {
    if (nameservers.isEmpty()) {
      return Optional.empty();
    }
    try {
      ExtendedResolver resolver = new ExtendedResolver(nameservers.toArray(new String[0]));
      resolver.setTimeout(timeout);
      Lookup lookup = new Lookup(Name.fromString(domain + "."), Type.SOA);
      lookup.setResolver(resolver);
      // Bypass the process-wide lookup cache.
      lookup.setCache(null);
      Record[] answers = lookup.run();
      if (lookup.getResult() != Lookup.SUCCESSFUL || answers == null || answers.length == 0) {
        logger.atInfo().log(
            "No SOA found for %s at %s: %s", domain, nameservers, lookup.getErrorString());
        return Optional.empty();
      }
      return Optional.of(answers[0].rdataToString());
    } catch (IOException e) {
      logger.atWarning().withCause(e).log("SOA lookup for %s failed", domain);
      return Optional.empty();
    }
  }
}
