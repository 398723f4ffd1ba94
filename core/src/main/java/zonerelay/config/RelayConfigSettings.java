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

package zonerelay.config;

import java.util.List;

/** The POJO that zonerelay YAML config files are deserialized into. */
public class RelayConfigSettings {

  public Linode linode;
  public Dns dns;

  /** Configuration options for the Linode API connection. */
  public static class Linode {
    public String apiUrl;
    public String apiKey;
    public int pageSize;
    public int connectTimeoutSeconds;
    public int readTimeoutSeconds;
  }

  /** Configuration options for record reconciliation and zone synthesis. */
  public static class Dns {
    public int defaultTtl;
    public List<String> hostingNameservers;
    public int zoneAuthorityPollAttempts;
    public int zoneAuthorityPollIntervalMillis;
    public int soaLookupTimeoutSeconds;
  }
}
