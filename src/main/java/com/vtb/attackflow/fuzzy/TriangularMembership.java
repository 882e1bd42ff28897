package com.vtb.attackflow.fuzzy;

import lombok.Value;

/**
 * Треугольная функция принадлежности (a, b, c).
 * a == b или b == c дают "плечо" со значением 1 на краю
 */
@Value
public class TriangularMembership {
    double a;
    double b;
    double c;

    public TriangularMembership(double a, double b, double c) {
        if (a > b || b > c) {
            throw new IllegalArgumentException("Ожидается a <= b <= c, получено: " + a + ", " + b + ", " + c);
        }
        this.a = a;
        this.b = b;
        this.c = c;
    }

    public static TriangularMembership of(double a, double b, double c) {
        return new TriangularMembership(a, b, c);
    }

    public double degree(double x) {
        if (x < a || x > c) {
            return 0.0;
        }
        if (x == b) {
            return 1.0;
        }
        if (x < b) {
            return (x - a) / (b - a);
        }
        return (c - x) / (c - b);
    }
}
