package org.metricshub.jpascal.jrt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jpascal
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ArithmeticTest {

	@Test
	public void testIntegerOperationsStayInteger() {
		assertEquals(7L, Arithmetic.add(3L, 4L));
		assertEquals(-1L, Arithmetic.subtract(3L, 4L));
		assertEquals(12L, Arithmetic.multiply(3L, 4L));
	}

	@Test
	public void testRealOperandMakesReal() {
		assertEquals(7.0, Arithmetic.add(3L, 4.0));
		assertEquals(-1.0, Arithmetic.subtract(3.0, 4L));
		assertEquals(6.0, Arithmetic.multiply(1.5, 4L));
	}

	@Test
	public void testIntegerDivideFloors() {
		assertEquals(3L, Arithmetic.integerDivide(7L, 2L));
		assertEquals(-4L, Arithmetic.integerDivide(-7L, 2L));
		assertEquals(-4L, Arithmetic.integerDivide(7L, -2L));
		assertEquals(3L, Arithmetic.integerDivide(-7L, -2L));
	}

	@Test
	public void testIntegerDivideWithReal() {
		assertEquals(3.0, Arithmetic.integerDivide(7.5, 2L));
		assertEquals(-4.0, Arithmetic.integerDivide(-7.5, 2L));
	}

	@Test
	public void testIntegerDivideWithInexactRealQuotient() {
		// 1 / 0.1 rounds to 10.0, yet 0.1 fits only 9 times in 1
		assertEquals(9.0, Arithmetic.integerDivide(1L, 0.1));
		assertEquals(-10.0, Arithmetic.integerDivide(-1L, 0.1));
		assertEquals(-1.0, Arithmetic.integerDivide(-0.5, 2L));
	}

	@Test
	public void testFloatDivideIsAlwaysReal() {
		assertEquals(Double.valueOf(3.0), Arithmetic.floatDivide(6L, 2L));
		assertEquals(Double.valueOf(3.5), Arithmetic.floatDivide(7L, 2L));
	}

	@Test
	public void testNegatePreservesType() {
		assertEquals(-5L, Arithmetic.negate(5L));
		assertEquals(-2.5, Arithmetic.negate(2.5));
	}

	@Test
	public void testIsZero() {
		assertTrue(Arithmetic.isZero(0L));
		assertTrue(Arithmetic.isZero(0.0));
		assertTrue(Arithmetic.isZero(-0.0));
		assertFalse(Arithmetic.isZero(1L));
		assertFalse(Arithmetic.isZero(0.5));
	}

	@Test
	public void testOverflow() {
		assertThrows(ArithmeticException.class, () -> Arithmetic.add(Long.MAX_VALUE, 1L));
		assertThrows(ArithmeticException.class, () -> Arithmetic.multiply(Long.MAX_VALUE, 2L));
		assertThrows(ArithmeticException.class, () -> Arithmetic.negate(Long.MIN_VALUE));
		assertThrows(ArithmeticException.class, () -> Arithmetic.integerDivide(Long.MIN_VALUE, -1L));
	}

	@Test
	public void testNormalize() {
		assertEquals(Long.valueOf(3L), Arithmetic.normalize(Integer.valueOf(3)));
		assertEquals(Long.valueOf(3L), Arithmetic.normalize(Short.valueOf((short) 3)));
		assertEquals(Double.valueOf(1.5), Arithmetic.normalize(Float.valueOf(1.5f)));
		assertEquals(Long.valueOf(7L), Arithmetic.normalize(Long.valueOf(7L)));
	}
}
