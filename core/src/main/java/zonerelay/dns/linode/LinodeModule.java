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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Duration;
import okhttp3.OkHttpClient;
import zonerelay.config.RelayConfig.Config;
import zonerelay.dns.DefaultRecordCanonicalizer;
import zonerelay.dns.DnsProvider;
import zonerelay.dns.DnsjavaSoaLookup;
import zonerelay.dns.RecordCanonicalizer;
import zonerelay.dns.RecordPolicy;
import zonerelay.dns.SoaLookup;
import zonerelay.util.Sleeper;
import zonerelay.util.SystemSleeper;

/** Dagger module that wires the Linode {@link DnsProvider} and its collaborators. */
@Module
public abstract class LinodeModule {

  private static final String LINODE_HTTP_CLIENT = "linodeHttpClient";

  @Binds
  abstract DnsProvider bindDnsProvider(LinodeDnsProvider provider);

  @Binds
  abstract SoaLookup bindSoaLookup(DnsjavaSoaLookup soaLookup);

  @Binds
  abstract RecordCanonicalizer bindRecordCanonicalizer(DefaultRecordCanonicalizer canonicalizer);

  @Binds
  abstract Sleeper bindSleeper(SystemSleeper sleeper);

  @Provides
  @Singleton
  @Named(LINODE_HTTP_CLIENT)
  static OkHttpClient provideLinodeHttpClient(
      @Config("linodeConnectTimeout") Duration connectTimeout,
      @Config("linodeReadTimeout") Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .build();
  }

  @Provides
  @Singleton
  static ObjectMapper provideObjectMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  @Provides
  static RecordPolicy provideRecordPolicy(@Config("dnsDefaultTtl") int defaultTtl) {
    return new RecordPolicy(
        LinodeDnsProvider.PERMITTED_RECORD_TYPES,
        LinodeDnsProvider.CNAME_APEX_RESTRICTED,
        defaultTtl);
  }
}
