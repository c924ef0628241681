/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.datacloud.connector.transport.grpc;

import java.net.URI;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.datacloud.connector.ApiException;
import org.datacloud.connector.AuthenticationException;
import org.datacloud.connector.ConnectorConfig;
import org.datacloud.connector.QueryException;
import org.datacloud.connector.auth.AuthStrategy;
import org.datacloud.connector.auth.TokenStore;
import org.datacloud.connector.transport.AbstractTransportClient;
import org.datacloud.connector.transport.AuthExpiredException;
import org.datacloud.connector.transport.ColumnMetadata;
import org.datacloud.connector.transport.QueryParameters;
import org.datacloud.connector.transport.QueryPhase;
import org.datacloud.connector.transport.QueryStatus;
import org.datacloud.connector.transport.ResultPage;
import org.datacloud.connector.transport.grpc.QueryMessages.Column;
import org.datacloud.connector.transport.grpc.QueryMessages.GetQueryResultsRequest;
import org.datacloud.connector.transport.grpc.QueryMessages.GetQueryStatusRequest;
import org.datacloud.connector.transport.grpc.QueryMessages.QueryResultsResponse;
import org.datacloud.connector.transport.grpc.QueryMessages.QueryStatusResponse;
import org.datacloud.connector.transport.grpc.QueryMessages.SubmitQueryRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Sets;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientInterceptors;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ClientCalls;

/**
 * Query service over gRPC, one unary call per operation. The channel is
 * opened on first use, against {@code grpcTarget} or the instance host on
 * port 443.
 */
public class GrpcTransportClient extends AbstractTransportClient {

  private static final Logger LOG = LoggerFactory.getLogger(GrpcTransportClient.class);

  static final int DEFAULT_PORT = 443;
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
  private static final Set<Status.Code> TRANSIENT_CODES = Sets.immutableEnumSet(
      Status.Code.UNAVAILABLE, Status.Code.DEADLINE_EXCEEDED, Status.Code.RESOURCE_EXHAUSTED,
      Status.Code.ABORTED, Status.Code.INTERNAL, Status.Code.UNKNOWN);

  private final ConnectorConfig config;
  private ManagedChannel channel;
  private Channel authorizedChannel;

  public GrpcTransportClient(AuthStrategy auth, ConnectorConfig config) {
    super(auth);
    this.config = config;
  }

  @VisibleForTesting
  GrpcTransportClient(AuthStrategy auth, ConnectorConfig config, ManagedChannel channel) {
    this(auth, config);
    this.channel = channel;
    this.authorizedChannel = ClientInterceptors.intercept(channel,
        new BearerTokenClientInterceptor());
  }

  @Override
  public QueryStatus submitQuery(String sql, QueryParameters params) throws SQLException {
    SubmitQueryRequest request = new SubmitQueryRequest();
    request.setSql(sql);
    if (params != null && !params.isEmpty()) {
      Object json = params.toJsonValue();
      if (params.isNamed()) {
        @SuppressWarnings("unchecked")
        Map<String, Object> named = (Map<String, Object>) json;
        request.setNamedParameters(named);
      } else {
        @SuppressWarnings("unchecked")
        List<Object> positional = (List<Object>) json;
        request.setPositionalParameters(positional);
      }
    }
    return invoke("submit query", token -> {
      QueryStatus status = toStatus(call(QueryServiceDescriptors.SUBMIT_QUERY, request, token),
          null);
      LOG.debug("Submitted query {}", status.getQueryId());
      return status;
    });
  }

  @Override
  public QueryStatus getQueryStatus(String queryId) throws SQLException {
    GetQueryStatusRequest request = new GetQueryStatusRequest(queryId);
    return invoke("get query status", token ->
        toStatus(call(QueryServiceDescriptors.GET_QUERY_STATUS, request, token), queryId));
  }

  @Override
  public ResultPage getQueryResults(String queryId, long offset, int limit) throws SQLException {
    GetQueryResultsRequest request = new GetQueryResultsRequest(queryId, offset, limit);
    return invoke("get query results", token -> {
      QueryResultsResponse response =
          call(QueryServiceDescriptors.GET_QUERY_RESULTS, request, token);
      List<List<Object>> rows = response.getRows() == null
          ? Collections.emptyList() : response.getRows();
      Long totalRows = response.getTotalRows();
      boolean last;
      if (rows.isEmpty()) {
        last = true;
      } else if (totalRows != null) {
        // pages may be capped below the limit, only the total tells
        last = offset + rows.size() >= totalRows;
      } else if (response.getLast() != null) {
        last = response.getLast();
      } else {
        last = rows.size() < limit;
      }
      return new ResultPage(rows, offset, last, totalRows);
    });
  }

  @Override
  protected synchronized void doClose() {
    if (channel == null) {
      return;
    }
    channel.shutdown();
    try {
      if (!channel.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        LOG.warn("Channel did not terminate gracefully, forcing shutdown");
        channel.shutdownNow();
      }
    } catch (InterruptedException e) {
      LOG.warn("Interrupted during channel shutdown", e);
      channel.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private synchronized Channel channel(TokenStore token) throws ApiException {
    if (authorizedChannel == null) {
      String target = config.getGrpcTarget() != null ? config.getGrpcTarget()
          : hostOf(token.getInstanceUrl()) + ":" + DEFAULT_PORT;
      ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forTarget(target);
      if (config.isGrpcPlaintext()) {
        builder.usePlaintext();
      } else {
        builder.useTransportSecurity();
      }
      LOG.info("Opening gRPC channel to {}", target);
      channel = builder.build();
      authorizedChannel = ClientInterceptors.intercept(channel, new BearerTokenClientInterceptor());
    }
    return authorizedChannel;
  }

  private static String hostOf(String instanceUrl) throws ApiException {
    String host;
    try {
      host = URI.create(instanceUrl).getHost();
    } catch (IllegalArgumentException e) {
      throw new ApiException("Invalid instance url " + instanceUrl, e);
    }
    if (host == null) {
      throw new ApiException("Instance url " + instanceUrl + " has no host");
    }
    return host;
  }

  private <ReqT, RespT> RespT call(MethodDescriptor<ReqT, RespT> method, ReqT request,
      TokenStore token) throws SQLException, AuthExpiredException {
    CallOptions options = CallOptions.DEFAULT
        .withOption(BearerTokenClientInterceptor.ACCESS_TOKEN, token.getAccessToken())
        .withDeadlineAfter(config.getSocketTimeoutMs(), TimeUnit.MILLISECONDS);
    try {
      return ClientCalls.blockingUnaryCall(channel(token), method, options, request);
    } catch (StatusRuntimeException e) {
      Status status = e.getStatus();
      String description = status.getDescription() == null
          ? status.getCode().name() : status.getDescription();
      switch (status.getCode()) {
      case UNAUTHENTICATED:
        throw new AuthExpiredException(method.getBareMethodName() + ": " + description);
      case PERMISSION_DENIED:
        throw new AuthenticationException("Access denied: " + description, e);
      case INVALID_ARGUMENT:
        throw new QueryException(description, null, e);
      default:
        throw new ApiException(method.getBareMethodName() + " failed with "
            + status.getCode() + ": " + description, status.getCode().value(),
            TRANSIENT_CODES.contains(status.getCode()), e);
      }
    }
  }

  private static QueryStatus toStatus(QueryStatusResponse response, String knownQueryId)
      throws ApiException {
    String queryId = response.getQueryId() != null ? response.getQueryId() : knownQueryId;
    if (queryId == null || queryId.isEmpty()) {
      throw new ApiException("Response carries no queryId");
    }
    List<ColumnMetadata> columns = null;
    if (response.getColumns() != null) {
      columns = new ArrayList<>(response.getColumns().size());
      for (Column column : response.getColumns()) {
        if (column.getName() == null) {
          throw new ApiException("Column metadata without a name for query " + queryId);
        }
        columns.add(new ColumnMetadata(column.getName(), column.getType(), column.getPrecision(),
            column.getScale(), column.getNullable() == null || column.getNullable()));
      }
    }
    return new QueryStatus(queryId, QueryPhase.fromServerState(response.getState()), columns,
        response.getTotalRows(), response.getErrorMessage());
  }
}
