package com.example.calculator;

/**
 * Calculator that keeps a single running total.
 *
 * <p>Arithmetic is plain {@code int} arithmetic, so a total that overflows
 * wraps around silently. Instances are not thread-safe.
 */
public class Calculator {

    private int result;

    public Calculator() {
        this.result = 0;
    }

    public void add(int num) {
        result += num;
    }

    public void subtract(int num) {
        result -= num;
    }

    public int getResult() {
        return result;
    }
}
