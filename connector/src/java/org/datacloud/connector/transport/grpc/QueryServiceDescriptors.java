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

import org.datacloud.connector.transport.grpc.QueryMessages.GetQueryResultsRequest;
import org.datacloud.connector.transport.grpc.QueryMessages.GetQueryStatusRequest;
import org.datacloud.connector.transport.grpc.QueryMessages.QueryResultsResponse;
import org.datacloud.connector.transport.grpc.QueryMessages.QueryStatusResponse;
import org.datacloud.connector.transport.grpc.QueryMessages.SubmitQueryRequest;

import io.grpc.MethodDescriptor;

/**
 * Unary methods of the {@value #SERVICE_NAME} service.
 */
public final class QueryServiceDescriptors {

  public static final String SERVICE_NAME = "datacloud.query.v1.QueryService";

  public static final MethodDescriptor<SubmitQueryRequest, QueryStatusResponse> SUBMIT_QUERY =
      unary("SubmitQuery", SubmitQueryRequest.class, QueryStatusResponse.class);

  public static final MethodDescriptor<GetQueryStatusRequest, QueryStatusResponse>
      GET_QUERY_STATUS = unary("GetQueryStatus", GetQueryStatusRequest.class,
          QueryStatusResponse.class);

  public static final MethodDescriptor<GetQueryResultsRequest, QueryResultsResponse>
      GET_QUERY_RESULTS = unary("GetQueryResults", GetQueryResultsRequest.class,
          QueryResultsResponse.class);

  private QueryServiceDescriptors() {
  }

  private static <ReqT, RespT> MethodDescriptor<ReqT, RespT> unary(String method,
      Class<ReqT> requestType, Class<RespT> responseType) {
    return MethodDescriptor.<ReqT, RespT>newBuilder()
        .setType(MethodDescriptor.MethodType.UNARY)
        .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE_NAME, method))
        .setRequestMarshaller(new JsonMarshaller<>(requestType))
        .setResponseMarshaller(new JsonMarshaller<>(responseType))
        .build();
  }
}
