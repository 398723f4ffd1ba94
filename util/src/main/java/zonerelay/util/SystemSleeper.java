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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.util.concurrent.Uninterruptibles;
import jakarta.inject.Inject;
import java.time.Duration;

/** Implementation of {@link Sleeper} that actually blocks the calling thread. */
public final class SystemSleeper implements Sleeper {

  @Inject
  public SystemSleeper() {}

  @Override
  public void sleepUninterruptibly(Duration duration) {
    checkArgument(!duration.isNegative(), "Sleep duration must not be negative: %s", duration);
    Uninterruptibles.sleepUninterruptibly(duration);
  }
}
