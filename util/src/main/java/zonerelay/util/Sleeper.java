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

package zonerelay.util;

import java.time.Duration;

/** An object which can pause the current thread, replaceable in tests. */
public interface Sleeper {

  /** Puts the current thread to sleep, ignoring interrupts until the duration has elapsed. */
  void sleepUninterruptibly(Duration duration);
}
