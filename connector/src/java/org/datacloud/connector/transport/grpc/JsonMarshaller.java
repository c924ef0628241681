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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.grpc.MethodDescriptor;
import io.grpc.Status;

/**
 * Marshals query service messages as JSON.
 */
public final class JsonMarshaller<T> implements MethodDescriptor.Marshaller<T> {

  static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
      .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private final Class<T> type;

  public JsonMarshaller(Class<T> type) {
    this.type = type;
  }

  @Override
  public InputStream stream(T value) {
    try {
      return new ByteArrayInputStream(MAPPER.writeValueAsBytes(value));
    } catch (IOException e) {
      throw Status.INTERNAL.withDescription("Cannot encode " + type.getSimpleName())
          .withCause(e).asRuntimeException();
    }
  }

  @Override
  public T parse(InputStream stream) {
    try {
      return MAPPER.readValue(stream, type);
    } catch (IOException e) {
      throw Status.INTERNAL.withDescription("Malformed " + type.getSimpleName() + ": "
          + e.getMessage()).withCause(e).asRuntimeException();
    }
  }
}
