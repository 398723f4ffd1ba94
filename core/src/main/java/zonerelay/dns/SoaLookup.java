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
import java.util.Optional;

/** Looks up the SOA record of a domain from a given set of nameservers. */
public interface SoaLookup {

  /**
   * Returns the SOA rdata in presentation format, or empty if no nameserver answered with one.
   *
   * <p>For example {@code "ns1.linode.com. hostmaster.example.com. 2021000001 14400 14400 1209600
   * 86400"}.
   */
  Optional<String> lookupSoa(String domain, ImmutableList<String> nameservers);
}
