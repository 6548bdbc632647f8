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

/**
 * Numeric operations of the language.
 * <p>
 * Values are either {@link Long} (integer) or {@link Double} (real).
 * An operation on two integers yields an integer, any real operand makes
 * the result real, and {@link #floatDivide(Number, Number)} always yields
 * a real. Integer overflow throws {@link ArithmeticException}. Callers
 * check divisors with {@link #isZero(Number)} before dividing.
 */
public final class Arithmetic {

	private Arithmetic() {}

	/**
	 * Converts any Java number to the representation used at runtime.
	 *
	 * @param n a number, such as a binding supplied by the caller
	 * @return a {@link Long} for integral types, a {@link Double} otherwise
	 */
	public static Number normalize(Number n) {
		if (n instanceof Long || n instanceof Double) {
			return n;
		}
		if (n instanceof Integer || n instanceof Short || n instanceof Byte) {
			return Long.valueOf(n.longValue());
		}
		return Double.valueOf(n.doubleValue());
	}

	public static boolean isInteger(Number n) {
		return n instanceof Long;
	}

	public static boolean isZero(Number n) {
		if (isInteger(n)) {
			return n.longValue() == 0L;
		}
		return n.doubleValue() == 0.0;
	}

	public static Number add(Number a, Number b) {
		if (isInteger(a) && isInteger(b)) {
			return Math.addExact(a.longValue(), b.longValue());
		}
		return a.doubleValue() + b.doubleValue();
	}

	public static Number subtract(Number a, Number b) {
		if (isInteger(a) && isInteger(b)) {
			return Math.subtractExact(a.longValue(), b.longValue());
		}
		return a.doubleValue() - b.doubleValue();
	}

	public static Number multiply(Number a, Number b) {
		if (isInteger(a) && isInteger(b)) {
			return Math.multiplyExact(a.longValue(), b.longValue());
		}
		return a.doubleValue() * b.doubleValue();
	}

	/**
	 * <code>DIV</code>: division rounded towards negative infinity.
	 * Two integers give an integer, otherwise the floored real quotient.
	 *
	 * @param a dividend
	 * @param b divisor, not zero
	 * @return the floored quotient
	 */
	public static Number integerDivide(Number a, Number b) {
		if (isInteger(a) && isInteger(b)) {
			long dividend = a.longValue();
			long divisor = b.longValue();
			if (dividend == Long.MIN_VALUE && divisor == -1L) {
				throw new ArithmeticException("long overflow");
			}
			return Math.floorDiv(dividend, divisor);
		}
		return floorDivide(a.doubleValue(), b.doubleValue());
	}

	/**
	 * Floor of <code>x / y</code> computed from the remainder, so that an
	 * inexact quotient such as <code>1 / 0.1</code> is not rounded up before
	 * the floor is taken.
	 */
	private static double floorDivide(double x, double y) {
		double mod = x % y;
		double div = (x - mod) / y;
		if (mod != 0.0 && (y < 0.0) != (mod < 0.0)) {
			div -= 1.0;
		}
		if (div == 0.0) {
			return Math.copySign(0.0, x / y);
		}
		double floor = Math.floor(div);
		if (div - floor > 0.5) {
			floor += 1.0;
		}
		return floor;
	}

	/**
	 * <code>/</code>: real division, whatever the operand types.
	 *
	 * @param a dividend
	 * @param b divisor, not zero
	 * @return the real quotient
	 */
	public static Double floatDivide(Number a, Number b) {
		return a.doubleValue() / b.doubleValue();
	}

	public static Number negate(Number a) {
		if (isInteger(a)) {
			return Math.negateExact(a.longValue());
		}
		return -a.doubleValue();
	}
}
