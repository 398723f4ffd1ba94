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

/** Base class for failures reported by a {@link DnsProvider}. */
public class DnsProviderException extends Exception {

  public DnsProviderException(String message) {
    super(message);
  }

  public DnsProviderException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Thrown when a record fails validation. Nothing has been sent to the provider. */
  public static class InvalidRecordException extends DnsProviderException {
    public InvalidRecordException(String message) {
      super(message);
    }
  }

  /** Thrown when a mutation targets a record whose provider identifier cannot be found. */
  public static class RecordNotFoundException extends DnsProviderException {
    public RecordNotFoundException(String message) {
      super(message);
    }
  }

  /** Thrown when the provider does not host the requested zone. */
  public static class ZoneNotFoundException extends DnsProviderException {
    public ZoneNotFoundException(String zone) {
      super(String.format("Zone `%s' not found on provider", zone));
    }
  }

  /** Thrown when a request to the provider fails or is answered with an error. */
  public static class ProviderRequestException extends DnsProviderException {
    public ProviderRequestException(String message) {
      super(message);
    }

    public ProviderRequestException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Thrown when provider credentials are rejected. */
  public static class InvalidApiKeyException extends DnsProviderException {
    public InvalidApiKeyException(String message) {
      super(message);
    }

    public InvalidApiKeyException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
