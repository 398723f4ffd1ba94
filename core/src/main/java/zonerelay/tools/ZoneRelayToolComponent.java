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

import dagger.Component;
import jakarta.inject.Singleton;
import zonerelay.config.RelayConfig.ConfigModule;
import zonerelay.dns.linode.LinodeModule;

/**
 * Dagger component for the zonerelay tool.
 *
 * <p>Every command has an {@code inject} method here, which it calls from {@link
 * Command#injectFrom} once {@link ZoneRelayCli} has parsed its flags.
 */
@Singleton
@Component(modules = {ConfigModule.class, LinodeModule.class})
interface ZoneRelayToolComponent {
  void inject(AddRecordCommand command);

  void inject(CreateZoneCommand command);

  void inject(DeleteZoneCommand command);

  void inject(GetZoneCommand command);

  void inject(RemoveRecordCommand command);

  void inject(UpdateRecordCommand command);

  void inject(ValidateKeyCommand command);
}
