package com.example.calculator;

/**
 * Main application demonstrating the running total of a Calculator.
 */
public class MainApp {
    public static void main(String[] args) {
        Calculator calc = new Calculator();
        calc.add(10);
        calc.subtract(5);

        System.out.println(formatResult(calc.getResult()));
    }

    static String formatResult(int value) {
        return "Result: " + value;
    }
}
