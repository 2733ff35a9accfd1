package com.dnobretech.loaningestor.util;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Normalização de células cruas da planilha antes da classificação.
 */
public final class ValueNormalizer {

    /** maior quantidade de dígitos inteiros aceita (cabe em um long) */
    public static final int MAX_INTEGER_DIGITS = 19;

    private ValueNormalizer() {
    }

    /**
     * Corrige artefatos de notação científica (Aadhaar/telefone salvos como número no Excel):
     * "1.23456789012E+11" -> "123456789012". Se não der para converter, devolve o original.
     */
    public static String fixScientific(String v) {
        if (v == null) return null;
        String s = v.trim();
        if (!s.toLowerCase(Locale.ROOT).contains("e+")) return s;
        try {
            BigDecimal d = new BigDecimal(s);
            if (tooWide(d)) return s;
            return d.toBigInteger().toString();
        } catch (NumberFormatException | ArithmeticException e) {
            return s;
        }
    }

    /**
     * Decimal finito em texto simples: "45000.50" -> "45000.5", "4.5E+5" -> "450000".
     * Devolve null quando o texto não é numérico ou não cabe em 19 dígitos de cada lado da vírgula.
     */
    public static String plainDecimal(String v) {
        if (v == null) return null;
        try {
            BigDecimal d = new BigDecimal(v.trim()).stripTrailingZeros();
            if (tooWide(d) || d.scale() > MAX_INTEGER_DIGITS) return null;
            return d.toPlainString();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    // checa o expoente antes de expandir: "1e+20000000" não pode virar um BigInteger de 20 milhões de dígitos
    private static boolean tooWide(BigDecimal d) {
        return (long) d.precision() - d.scale() > MAX_INTEGER_DIGITS;
    }

    /** Primeira letra de cada palavra em maiúscula, restante em minúscula ("john SMITH" -> "John Smith"). */
    public static String titleCase(String v) {
        if (v == null) return null;
        StringBuilder sb = new StringBuilder(v.length());
        boolean startOfWord = true;
        for (int i = 0; i < v.length(); i++) {
            char c = v.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }
}
