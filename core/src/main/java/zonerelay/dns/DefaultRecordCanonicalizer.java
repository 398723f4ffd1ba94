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

import static com.google.common.base.Strings.isNullOrEmpty;
import static com.google.common.base.Strings.nullToEmpty;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.net.InetAddresses;
import com.google.common.primitives.Ints;
import jakarta.inject.Inject;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.List;
import zonerelay.dns.DnsProviderException.InvalidRecordException;
import zonerelay.dns.RecordData.CaaData;
import zonerelay.dns.RecordData.MxData;
import zonerelay.dns.RecordData.SrvData;
import zonerelay.dns.RecordData.TargetData;

/**
 * Default {@link RecordCanonicalizer}.
 *
 * <p>Names are lower-cased and made relative to the zone ({@code @} and the zone itself both mean
 * the apex). Host names inside parameters are lower-cased and lose their trailing dot. TXT and CAA
 * values lose their enclosing double quotes.
 */
public class DefaultRecordCanonicalizer implements RecordCanonicalizer {

  private static final CharMatcher NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("-._*"))
          .precomputed();
  private static final CharMatcher CAA_TAG_CHARS =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('0', '9')).precomputed();
  private static final Splitter TOKEN_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).trimResults().omitEmptyStrings();

  private final RecordPolicy policy;

  @Inject
  public DefaultRecordCanonicalizer(RecordPolicy policy) {
    this.policy = policy;
  }

  @Override
  public CanonicalRecord canonicalize(String zone, RecordFields fields)
      throws InvalidRecordException {
    String normalizedZone = normalizeZone(zone);
    if (fields.name() == null) {
      throw new InvalidRecordException("Record name is required");
    }
    if (isNullOrEmpty(fields.type())) {
      throw new InvalidRecordException("Record type is required");
    }
    if (fields.parameter() == null) {
      throw new InvalidRecordException("Record parameter is required");
    }
    String name = normalizeName(normalizedZone, fields.name());
    RecordType type = parseType(fields.type());
    if (type == RecordType.CNAME && name.isEmpty() && policy.cnameApexRestricted()) {
      throw new InvalidRecordException(
          String.format("CNAME records cannot be created at the apex of `%s'", normalizedZone));
    }
    int ttl = checkTtl(fields.ttl());
    RecordData data = parseData(name, type, fields.parameter().trim());
    return CanonicalRecord.create(normalizedZone, name, type, ttl, data);
  }

  @Override
  public RecordFields canonicalizePatch(String zone, RecordFields patch)
      throws InvalidRecordException {
    String normalizedZone = normalizeZone(zone);
    String name = patch.name() == null ? null : normalizeName(normalizedZone, patch.name());
    String type = isNullOrEmpty(patch.type()) ? null : parseType(patch.type()).name();
    String parameter = patch.parameter() == null ? null : patch.parameter().trim();
    Integer ttl = patch.ttl() == null ? null : checkTtl(patch.ttl());
    return new RecordFields(name, type, parameter, ttl);
  }

  private static String normalizeZone(String zone) throws InvalidRecordException {
    String normalized = stripTrailingDot(Ascii.toLowerCase(nullToEmpty(zone).trim()));
    if (normalized.isEmpty()) {
      throw new InvalidRecordException("Zone is required");
    }
    return normalized;
  }

  private static String normalizeName(String zone, String rawName) throws InvalidRecordException {
    String name = stripTrailingDot(Ascii.toLowerCase(rawName.trim()));
    if (name.equals("@") || name.equals(zone)) {
      return "";
    }
    if (name.endsWith("." + zone)) {
      name = name.substring(0, name.length() - zone.length() - 1);
    }
    if (!NAME_CHARS.matchesAllOf(name) || name.startsWith(".") || name.contains("..")) {
      throw new InvalidRecordException(String.format("Invalid record name `%s'", rawName));
    }
    return name;
  }

  private RecordType parseType(String rawType) throws InvalidRecordException {
    RecordType type =
        RecordType.fromString(rawType)
            .orElseThrow(
                () ->
                    new InvalidRecordException(
                        String.format("Unknown record type `%s'", rawType)));
    if (!policy.permittedTypes().contains(type)) {
      throw new InvalidRecordException(
          String.format("Record type `%s' is not supported by this provider", type));
    }
    return type;
  }

  private int checkTtl(Integer ttl) throws InvalidRecordException {
    if (ttl == null) {
      return policy.defaultTtl();
    }
    if (ttl < 0) {
      throw new InvalidRecordException(String.format("Invalid TTL %d", ttl));
    }
    return ttl;
  }

  private static RecordData parseData(String name, RecordType type, String parameter)
      throws InvalidRecordException {
    switch (type) {
      case A:
        return new TargetData(parseAddress(parameter, Inet4Address.class, type));
      case AAAA:
        return new TargetData(parseAddress(parameter, Inet6Address.class, type));
      case CNAME:
      case NS:
      case PTR:
        return new TargetData(normalizeHost(parameter, type));
      case TXT:
        return new TargetData(unquote(parameter));
      case MX:
        {
          List<String> tokens = tokenize(parameter, 2, type);
          return new MxData(
              parseUnsigned(tokens.get(0), 0xFFFF, "priority", type),
              normalizeHost(tokens.get(1), type));
        }
      case SRV:
        {
          List<String> tokens = tokenize(parameter, 4, type);
          List<String> labels = Splitter.on('.').splitToList(name);
          if (labels.size() < 2
              || !labels.get(0).startsWith("_")
              || !labels.get(1).startsWith("_")) {
            throw new InvalidRecordException(
                String.format("SRV record name `%s' must start with _service._protocol", name));
          }
          return new SrvData(
              labels.get(0).substring(1),
              labels.get(1).substring(1),
              parseUnsigned(tokens.get(0), 0xFFFF, "priority", type),
              parseUnsigned(tokens.get(1), 0xFFFF, "weight", type),
              parseUnsigned(tokens.get(2), 0xFFFF, "port", type),
              normalizeHost(tokens.get(3), type));
        }
      case CAA:
        {
          List<String> tokens =
              Splitter.on(CharMatcher.whitespace())
                  .omitEmptyStrings()
                  .limit(3)
                  .splitToList(parameter);
          if (tokens.size() != 3) {
            throw new InvalidRecordException(
                String.format("CAA parameter `%s' must be <flags> <tag> <value>", parameter));
          }
          String tag = Ascii.toLowerCase(tokens.get(1));
          if (!CAA_TAG_CHARS.matchesAllOf(tag)) {
            throw new InvalidRecordException(String.format("Invalid CAA tag `%s'", tokens.get(1)));
          }
          String value = unquote(tokens.get(2).trim());
          if (value.isEmpty()) {
            throw new InvalidRecordException("CAA value is required");
          }
          return new CaaData(parseUnsigned(tokens.get(0), 0xFF, "flags", type), tag, value);
        }
      default:
        throw new InvalidRecordException(
            String.format("Record type `%s' cannot be canonicalized", type));
    }
  }

  private static String parseAddress(
      String parameter, Class<? extends InetAddress> family, RecordType type)
      throws InvalidRecordException {
    if (!InetAddresses.isInetAddress(parameter)) {
      throw new InvalidRecordException(
          String.format("Invalid %s address `%s'", type, parameter));
    }
    InetAddress address = InetAddresses.forString(parameter);
    if (!family.isInstance(address)) {
      throw new InvalidRecordException(
          String.format("Invalid %s address `%s'", type, parameter));
    }
    return InetAddresses.toAddrString(address);
  }

  private static String normalizeHost(String host, RecordType type)
      throws InvalidRecordException {
    String normalized = stripTrailingDot(Ascii.toLowerCase(host.trim()));
    if (normalized.isEmpty() || !NAME_CHARS.matchesAllOf(normalized)) {
      throw new InvalidRecordException(
          String.format("Invalid %s target `%s'", type, host));
    }
    return normalized;
  }

  private static ImmutableList<String> tokenize(String parameter, int count, RecordType type)
      throws InvalidRecordException {
    ImmutableList<String> tokens = ImmutableList.copyOf(TOKEN_SPLITTER.split(parameter));
    if (tokens.size() != count) {
      throw new InvalidRecordException(
          String.format(
              "%s parameter `%s' must have %d fields, found %d",
              type, parameter, count, tokens.size()));
    }
    return tokens;
  }

  private static int parseUnsigned(String token, int max, String field, RecordType type)
      throws InvalidRecordException {
    Integer value = Ints.tryParse(token);
    if (value == null || value < 0 || value > max) {
      throw new InvalidRecordException(
          String.format("Invalid %s %s `%s'", type, field, token));
    }
    return value;
  }

  private static String unquote(String value) {
    if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
      return value.substring(1, value.length() - 1);
    }
    return value;
  }

  private static String stripTrailingDot(String value) {
    return value.endsWith(".") ? value.substring(0, value.length() - 1) : value;
  }
}
