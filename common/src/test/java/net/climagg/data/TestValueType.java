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
package net.climagg.data;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.math.BigDecimal;

import org.junit.Test;

import net.climagg.exceptions.IllegalDataException;

public class TestValueType {

  @Test
  public void coerceInt() throws Exception {
    Coercion c = ValueType.INT.coerce(4.7);
    assertEquals(Coercion.State.VALUE, c.state());
    assertEquals(4.0, c.value(), 0.0000001);
    
    c = ValueType.INT.coerce(-4.7);
    assertEquals(-4.0, c.value(), 0.0000001);
    
    c = ValueType.INT.coerce(42L);
    assertEquals(42.0, c.value(), 0.0000001);
    
    c = ValueType.INT.coerce(" 17 ");
    assertEquals(17.0, c.value(), 0.0000001);
    
    c = ValueType.INT.coerce(1e300);
    assertEquals(Coercion.State.INVALID, c.state());
    assertFalse(c.isValid());
  }
  
  @Test
  public void coerceFloat() throws Exception {
    Coercion c = ValueType.FLOAT.coerce(4.25);
    assertEquals(4.25, c.value(), 0.0000001);
    
    c = ValueType.FLOAT.coerce(3);
    assertEquals(3.0, c.value(), 0.0000001);
  }
  
  @Test
  public void coerceNum() throws Exception {
    Coercion c = ValueType.NUM.coerce(1.23456789);
    assertEquals(1.2346, c.value(), 0.0000001);
    
    c = ValueType.NUM.coerce(new BigDecimal("2.00005"));
    assertEquals(2.0, c.value(), 0.0000001);
  }
  
  @Test
  public void coerceMissing() throws Exception {
    assertSame(Coercion.missing(), ValueType.FLOAT.coerce(null));
    assertSame(Coercion.missing(), ValueType.INT.coerce(""));
    assertTrue(ValueType.INT.coerce(null).isValid());
    assertNull(ValueType.INT.coerce(null).get());
  }
  
  @Test
  public void coerceInvalid() throws Exception {
    assertEquals(Coercion.State.INVALID, 
        ValueType.FLOAT.coerce(Double.NaN).state());
    assertEquals(Coercion.State.INVALID, 
        ValueType.FLOAT.coerce(Double.POSITIVE_INFINITY).state());
    assertEquals(Coercion.State.INVALID, 
        ValueType.INT.coerce("calm").state());
    assertEquals(Coercion.State.INVALID, 
        ValueType.INT.coerce(new Object()).state());
    
    try {
      ValueType.INT.coerce("calm").get();
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) { }
  }
  
  @Test
  public void fromName() throws Exception {
    assertSame(ValueType.INT, ValueType.fromName("int"));
    assertSame(ValueType.FLOAT, ValueType.fromName("FLOAT"));
    assertSame(ValueType.INT, ValueType.fromName("Record_int"));
    assertSame(ValueType.NUM, ValueType.fromName("Record_num"));
    
    try {
      ValueType.fromName("complex");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      ValueType.fromName(null);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
