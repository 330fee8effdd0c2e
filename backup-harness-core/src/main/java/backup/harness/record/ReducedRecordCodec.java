/*
 * Copyright 2016 Fortitude Technologies LLC
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 *     
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package backup.harness.record;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableList.Builder;

/**
 * Converts record sequences to and from the compact JSON array a backup
 * writes per object. A null entry in the array marks padding or the end of a
 * stream and decodes to an empty {@link Optional}.
 */
public class ReducedRecordCodec {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<ReducedRecord>> RECORDS = new TypeReference<List<ReducedRecord>>() {
  };

  /**
   * Null elements are written as JSON null.
   */
  public static byte[] encode(List<ReducedRecord> records) {
    try {
      return MAPPER.writeValueAsBytes(records);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize " + records.size() + " records", e);
    }
  }

  public static List<Optional<ReducedRecord>> decode(byte[] bs) {
    List<ReducedRecord> records;
    try {
      records = MAPPER.readValue(bs, RECORDS);
    } catch (IOException e) {
      throw new MalformedPayloadException("Payload of " + bs.length + " bytes is not a JSON array of records", e);
    }
    return toOptionals(records);
  }

  public static List<Optional<ReducedRecord>> decode(InputStream input) {
    List<ReducedRecord> records;
    try {
      records = MAPPER.readValue(input, RECORDS);
    } catch (IOException e) {
      throw new MalformedPayloadException("Stream is not a JSON array of records", e);
    }
    return toOptionals(records);
  }

  private static List<Optional<ReducedRecord>> toOptionals(List<ReducedRecord> records) {
    if (records == null) {
      throw new MalformedPayloadException("Payload is JSON null instead of an array");
    }
    Builder<Optional<ReducedRecord>> builder = ImmutableList.builder();
    for (ReducedRecord record : records) {
      builder.add(Optional.ofNullable(record));
    }
    return builder.build();
  }

}
