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

import com.google.common.collect.ImmutableMap;

/** Entry point of the zonerelay command-line tool. */
public final class ZoneRelayTool {

  /** Available commands, by command-line name. */
  public static final ImmutableMap<String, Class<? extends Command>> COMMAND_MAP =
      new ImmutableMap.Builder<String, Class<? extends Command>>()
          .put("add_record", AddRecordCommand.class)
          .put("create_zone", CreateZoneCommand.class)
          .put("delete_zone", DeleteZoneCommand.class)
          .put("get_zone", GetZoneCommand.class)
          .put("remove_record", RemoveRecordCommand.class)
          .put("update_record", UpdateRecordCommand.class)
          .put("validate_key", ValidateKeyCommand.class)
          .build();

  public static void main(String[] args) throws Exception {
    System.exit(new ZoneRelayCli("zonerelay", COMMAND_MAP).run(args));
  }

  private ZoneRelayTool() {}
}
