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

import com.google.common.base.Ascii;
import com.google.common.base.Enums;
import java.util.Optional;

/** Resource record types understood by the reconciliation engine. */
public enum RecordType {
  A,
  AAAA,
  CAA,
  CNAME,
  MX,
  NS,
  PTR,
  SRV,
  TXT,
  ANY;

  /** Parses a type mnemonic case-insensitively, returning empty for unknown types. */
  public static Optional<RecordType> fromString(String value) {
    return Enums.getIfPresent(RecordType.class, Ascii.toUpperCase(value.trim())).toJavaUtil();
  }
}
