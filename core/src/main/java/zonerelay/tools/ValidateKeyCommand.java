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
import zonerelay.config.RelayConfig.Config;
import zonerelay.dns.linode.ApiKeyValidator;

/** Command to check a Linode API key against the account endpoint. */
@Parameters(separators = " =", commandDescription = "Check that a Linode API key is accepted")
final class ValidateKeyCommand implements Command {

  @Parameter(names = "--key", description = "Key to check; defaults to the configured key")
  String key;

  @Inject ApiKeyValidator apiKeyValidator;

  @Inject
  @Config("linodeApiKey")
  String configuredKey;

  @Override
  public void injectFrom(ZoneRelayToolComponent component) {
    component.inject(this);
  }

  @Override
  public void run() throws Exception {
    apiKeyValidator.validate(key == null ? configuredKey : key);
    System.out.println("Linode API key is valid");
  }
}
