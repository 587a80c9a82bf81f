// This file is part of ClimAgg.
// Copyright (C) 2026  The ClimAgg Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.climagg.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.Test;

import net.climagg.data.Flag;

public class TestYAML {

  @Test
  public void parseToObjectString() throws Exception {
    final Flag flag = YAML.parseToObject(
        "# trace precipitation\nvalue: -1\ndesc: trace\nin_data: true\n", 
        Flag.class);
    assertEquals(new Flag(-1, "trace", true), flag);
  }
  
  @Test
  public void parseToObjectStream() throws Exception {
    final InputStream stream = new ByteArrayInputStream(
        "value: 99\ndesc: unknown\n".getBytes(StandardCharsets.UTF_8));
    assertEquals(new Flag(99, "unknown", false), 
        YAML.parseToObject(stream, Flag.class));
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectNull() throws Exception {
    YAML.parseToObject((String) null, Flag.class);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectEmpty() throws Exception {
    YAML.parseToObject("", Flag.class);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectNullClass() throws Exception {
    YAML.parseToObject("value: 1", (Class<Flag>) null);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectBadData() throws Exception {
    YAML.parseToObject("value: [not, a, number]", Flag.class);
  }
  
  @Test
  public void serializeToString() throws Exception {
    final String yaml = YAML.serializeToString(new Flag(990, "variable", true));
    assertTrue(yaml.contains("value: 990"));
    assertTrue(yaml.contains("desc: \"variable\"") 
        || yaml.contains("desc: variable"));
    assertTrue(yaml.contains("in_data: true"));
    assertEquals(new Flag(990, "variable", true), 
        YAML.parseToObject(yaml, Flag.class));
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void serializeToStringNull() throws Exception {
    YAML.serializeToString(null);
  }
}
