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

import javax.annotation.Nullable;

/**
 * Raw, possibly sparse record input.
 *
 * <p>Used both as the input to canonicalization and as the patch operand of an atomic update, in
 * which case any unset field keeps the value of the record being updated.
 */
public record RecordFields(
    @Nullable String name,
    @Nullable String type,
    @Nullable String parameter,
    @Nullable Integer ttl) {

  public static RecordFields of(String name, String type, String parameter) {
    return new RecordFields(name, type, parameter, null);
  }

  public static RecordFields of(String name, String type, String parameter, Integer ttl) {
    return new RecordFields(name, type, parameter, ttl);
  }

  /** Returns a patch that only changes the TTL. */
  public static RecordFields ttlOnly(int ttl) {
    return new RecordFields(null, null, null, ttl);
  }

  /** Returns a copy of {@code base} with every field that is set here replaced. */
  public RecordFields mergeOnto(RecordFields base) {
    return new RecordFields(
        name != null ? name : base.name(),
        type != null ? type : base.type(),
        parameter != null ? parameter : base.parameter(),
        ttl != null ? ttl : base.ttl());
  }

  public boolean isEmpty() {
    return name == null && type == null && parameter == null && ttl == null;
  }
}
