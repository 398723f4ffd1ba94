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

package zonerelay.dns.linode.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import zonerelay.config.RelayConfig.Config;
import zonerelay.dns.linode.client.LinodeApiClient.ApiResponse;
import zonerelay.dns.linode.client.model.LinodeAccount;
import zonerelay.dns.linode.client.model.LinodeDomain;
import zonerelay.dns.linode.client.model.LinodeRecord;
import zonerelay.dns.linode.client.model.Page;

/**
 * Typed access to the Linode Domains API.
 *
 * <p>Based on the <a href="https://techdocs.akamai.com/linode-api/reference/get-domains">Linode API
 * v4 reference</a>. Request and response bodies are mapped with Jackson; mapping failures surface
 * as {@link LinodeApiException}.
 */
@Singleton
public class LinodeDomainsClient {

  private final LinodeApiClient apiClient;
  private final ObjectMapper objectMapper;
  private final int pageSize;

  @Inject
  public LinodeDomainsClient(
      LinodeApiClient apiClient,
      ObjectMapper objectMapper,
      @Config("linodePageSize") int pageSize) {
    this.apiClient = apiClient;
    this.objectMapper = objectMapper;
    this.pageSize = pageSize;
  }

  /** ZONE MANAGEMENT */
  public Page<LinodeDomain> listDomains(int page) throws LinodeApiException {
    ApiResponse response = apiClient.get("domains", pageParams(page));
    return readJson(response, pageOf(LinodeDomain.class));
  }

  public LinodeDomain createDomain(LinodeDomain domain) throws LinodeApiException {
    ApiResponse response = apiClient.post("domains", writeJson(domain));
    return readJson(response, objectMapper.constructType(LinodeDomain.class));
  }

  /** Deletes a zone and returns the HTTP status of the response. */
  public int deleteDomain(long domainId) throws LinodeApiException {
    return apiClient.delete("domains/" + domainId).statusCode();
  }

  /** RECORD MANAGEMENT */
  public Page<LinodeRecord> listRecords(long domainId, int page) throws LinodeApiException {
    ApiResponse response =
        apiClient.get(String.format("domains/%d/records", domainId), pageParams(page));
    return readJson(response, pageOf(LinodeRecord.class));
  }

  /** Fetches every page of the zone's records, in listing order. */
  public ImmutableList<LinodeRecord> listAllRecords(long domainId) throws LinodeApiException {
    ImmutableList.Builder<LinodeRecord> records = new ImmutableList.Builder<>();
    int pageNumber = 1;
    Page<LinodeRecord> page;
    do {
      page = listRecords(domainId, pageNumber++);
      records.addAll(page.data());
    } while (page.hasMorePages());
    return records.build();
  }

  public LinodeRecord createRecord(long domainId, LinodeRecord record) throws LinodeApiException {
    ApiResponse response =
        apiClient.post(String.format("domains/%d/records", domainId), writeJson(record));
    return readJson(response, objectMapper.constructType(LinodeRecord.class));
  }

  public LinodeRecord updateRecord(long domainId, long recordId, LinodeRecord record)
      throws LinodeApiException {
    ApiResponse response =
        apiClient.put(
            String.format("domains/%d/records/%d", domainId, recordId), writeJson(record));
    return readJson(response, objectMapper.constructType(LinodeRecord.class));
  }

  /** Deletes a record and returns the HTTP status of the response. */
  public int deleteRecord(long domainId, long recordId) throws LinodeApiException {
    return apiClient
        .delete(String.format("domains/%d/records/%d", domainId, recordId))
        .statusCode();
  }

  /** ACCOUNT */
  public LinodeAccount getAccount() throws LinodeApiException {
    ApiResponse response = apiClient.get("account", ImmutableMap.of());
    return readJson(response, objectMapper.constructType(LinodeAccount.class));
  }

  private ImmutableMap<String, String> pageParams(int page) {
    return ImmutableMap.of("page", String.valueOf(page), "page_size", String.valueOf(pageSize));
  }

  private JavaType pageOf(Class<?> elementType) {
    return objectMapper.getTypeFactory().constructParametricType(Page.class, elementType);
  }

  private <T> T readJson(ApiResponse response, JavaType type) throws LinodeApiException {
    try {
      return objectMapper.readValue(response.body(), type);
    } catch (JsonProcessingException e) {
      throw new LinodeApiException("Failed to parse Linode response: " + response.body(), e);
    }
  }

  private String writeJson(Object value) throws LinodeApiException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new LinodeApiException("Failed to serialize Linode request: " + value, e);
    }
  }
}
