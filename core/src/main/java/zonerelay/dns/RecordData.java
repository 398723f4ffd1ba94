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

/** Typed decomposition of a record's parameter. */
public interface RecordData {

  /** Returns the canonical parameter string for this data. */
  String toParameter();

  /** Data of A, AAAA, CNAME, NS, PTR and TXT records: a single value. */
  record TargetData(String target) implements RecordData {
    @Override
    public String toParameter() {
      return target;
    }
  }

  /** Mail exchanger data. */
  record MxData(int priority, String target) implements RecordData {
    @Override
    public String toParameter() {
      return priority + " " + target;
    }
  }

  /**
   * Service locator data.
   *
   * <p>{@code service} and {@code protocol} come from the owner name ({@code _sip._tcp}) and are
   * stored without their leading underscores; they are not part of the parameter.
   */
  record SrvData(String service, String protocol, int priority, int weight, int port, String target)
      implements RecordData {
    @Override
    public String toParameter() {
      return String.format("%d %d %d %s", priority, weight, port, target);
    }
  }

  /** Certification authority authorization data; {@code value} is stored unquoted. */
  record CaaData(int flags, String tag, String value) implements RecordData {
    @Override
    public String toParameter() {
      return flags + " " + tag + " " + value;
    }
  }
}
