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

package zonerelay.dns.linode;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.flogger.FluentLogger;
import java.util.Optional;
import javax.annotation.Nullable;
import zonerelay.dns.CanonicalRecord;
import zonerelay.dns.RecordData;
import zonerelay.dns.RecordData.CaaData;
import zonerelay.dns.RecordData.MxData;
import zonerelay.dns.RecordData.SrvData;
import zonerelay.dns.RecordData.TargetData;
import zonerelay.dns.RecordType;
import zonerelay.dns.linode.client.model.LinodeRecord;

/**
 * Translates between {@link CanonicalRecord} and the per-type field layout of Linode records.
 *
 * <p>Linode does not store CAA flags: they are dropped on the way out and read back as {@code 0}.
 */
public final class LinodeRecordCodec {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final CharMatcher UNDERSCORE = CharMatcher.is('_');
  private static final CharMatcher QUOTE = CharMatcher.is('"');

  /** CAA flags reported for every record read back from Linode. */
  static final int DEFAULT_CAA_FLAGS = 0;

  /**
   * Builds the request body for creating or replacing {@code record}.
   *
   * @throws UnsupportedRecordTypeException if the type has no Linode layout
   */
  public static LinodeRecord encode(CanonicalRecord record) {
    LinodeRecord.Builder builder =
        LinodeRecord.builder(record.type().name()).setTtlSec(record.ttl());
    switch (record.type()) {
      case A, AAAA, CNAME, TXT, NS, PTR ->
          builder.setName(record.name()).setTarget(record.parameter());
      case MX -> {
        MxData mx = (MxData) record.data();
        builder.setName(record.name()).setPriority(mx.priority()).setTarget(mx.target());
      }
      case SRV -> {
        // Linode derives the owner name from service and protocol.
        SrvData srv = (SrvData) record.data();
        builder
            .setProtocol(UNDERSCORE.trimLeadingFrom(srv.protocol()))
            .setService(srv.service())
            .setTarget(srv.target())
            .setPriority(srv.priority())
            .setWeight(srv.weight())
            .setPort(srv.port());
      }
      case CAA -> {
        CaaData caa = (CaaData) record.data();
        builder.setName(record.name()).setTag(caa.tag()).setTarget(QUOTE.trimFrom(caa.value()));
      }
      default -> throw new UnsupportedRecordTypeException(record.type());
    }
    return builder.build();
  }

  /** Renders the canonical parameter string of a record as Linode reports it. */
  public static String decodeParameter(LinodeRecord record) {
    return switch (Ascii.toUpperCase(record.type())) {
      case "CAA" -> DEFAULT_CAA_FLAGS + " " + record.tag() + " " + record.target();
      case "SRV" ->
          String.format(
              "%d %d %d %s",
              orZero(record.priority()),
              orZero(record.weight()),
              orZero(record.port()),
              record.target());
      case "MX" -> orZero(record.priority()) + " " + record.target();
      default -> Strings.nullToEmpty(record.target());
    };
  }

  /**
   * Converts a listed Linode record into a canonical record of {@code zone}.
   *
   * @param defaultTtl TTL to use when Linode reports none
   * @return empty, with a warning, if the record type is not one this engine knows
   */
  public static Optional<CanonicalRecord> decode(
      LinodeRecord record, String zone, int defaultTtl) {
    Optional<RecordType> type = RecordType.fromString(Strings.nullToEmpty(record.type()));
    if (type.isEmpty()) {
      logger.atWarning().log(
          "Skipping Linode record %s of unknown type `%s' in zone %s",
          record.id(), record.type(), zone);
      return Optional.empty();
    }
    String target = Strings.nullToEmpty(record.target());
    RecordData data =
        switch (type.get()) {
          case MX -> new MxData(orZero(record.priority()), target);
          case SRV ->
              new SrvData(
                  UNDERSCORE.trimLeadingFrom(Strings.nullToEmpty(record.service())),
                  UNDERSCORE.trimLeadingFrom(Strings.nullToEmpty(record.protocol())),
                  orZero(record.priority()),
                  orZero(record.weight()),
                  orZero(record.port()),
                  target);
          case CAA -> new CaaData(DEFAULT_CAA_FLAGS, Strings.nullToEmpty(record.tag()), target);
          default -> new TargetData(target);
        };
    int ttl = record.ttlSec() == null || record.ttlSec() == 0 ? defaultTtl : record.ttlSec();
    CanonicalRecord decoded =
        CanonicalRecord.create(zone, decodeName(record, data), type.get(), ttl, data);
    return Optional.of(decoded.withProviderId(record.id()));
  }

  private static String decodeName(LinodeRecord record, RecordData data) {
    String name = Ascii.toLowerCase(Strings.nullToEmpty(record.name()));
    if (name.isEmpty() && data instanceof SrvData) {
      SrvData srv = (SrvData) data;
      return "_" + srv.service() + "._" + srv.protocol();
    }
    return name;
  }

  private static int orZero(@Nullable Integer value) {
    return value == null ? 0 : value;
  }

  private LinodeRecordCodec() {}
}
