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

import zonerelay.dns.DnsProviderException.InvalidRecordException;

/** Validates and normalizes raw record input. */
public interface RecordCanonicalizer {

  /**
   * Canonicalizes a complete record.
   *
   * @throws InvalidRecordException if the name, type or parameter is missing or invalid, the type
   *     is not permitted, or the TTL is negative
   */
  CanonicalRecord canonicalize(String zone, RecordFields fields) throws InvalidRecordException;

  /**
   * Canonicalizes only the fields that are set on a patch, leaving the others unset.
   *
   * <p>A patch parameter can only be validated against a type; callers merge the patch onto the
   * full record and canonicalize the result to validate the combination.
   */
  RecordFields canonicalizePatch(String zone, RecordFields patch) throws InvalidRecordException;
}
