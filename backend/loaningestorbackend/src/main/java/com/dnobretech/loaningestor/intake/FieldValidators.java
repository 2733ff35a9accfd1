package com.dnobretech.loaningestor.intake;

import com.dnobretech.loaningestor.enums.EmploymentType;
import com.dnobretech.loaningestor.enums.LoanPurpose;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Regras de formato/faixa por campo. Todas recebem o valor cru, sem efeitos colaterais,
 * e devolvem false para ausentes/placeholders.
 */
public final class FieldValidators {

    public static final long LOAN_MIN = 500_000L;
    public static final long LOAN_MAX = 10_000_000L;
    public static final long INCOME_MIN = 25_000L;
    public static final long INCOME_MAX = 1_000_000L;

    private static final Set<String> PLACEHOLDERS = Set.of("", "nan", "none", "null", "nat");

    private static final Pattern ID = Pattern.compile("^A[0-9]+$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]{2,}$");
    private static final Pattern PHONE = Pattern.compile("^[6-9][0-9]{9}$");
    private static final Pattern AADHAAR = Pattern.compile("^[0-9]{12}$");
    private static final Pattern PAN = Pattern.compile("^[A-Z]{5}[0-9]{4}[A-Z]$");
    private static final Pattern ALPHA_SPACE = Pattern.compile("^[A-Za-z ]+$");
    private static final Pattern WS = Pattern.compile("\\s+");

    private FieldValidators() {
    }

    public static boolean isNull(String v) {
        return v == null || PLACEHOLDERS.contains(v.trim().toLowerCase(Locale.ROOT));
    }

    public static boolean validId(String v) {
        return !isNull(v) && ID.matcher(v.trim()).matches();
    }

    public static boolean validEmail(String v) {
        return !isNull(v) && EMAIL.matcher(v.trim()).matches();
    }

    public static boolean validPhone(String v) {
        return !isNull(v) && PHONE.matcher(v.trim()).matches();
    }

    public static boolean validAadhaar(String v) {
        return !isNull(v) && AADHAAR.matcher(v.trim()).matches();
    }

    public static boolean validPan(String v) {
        return !isNull(v) && PAN.matcher(v.trim().toUpperCase(Locale.ROOT)).matches();
    }

    public static boolean validName(String v) {
        if (isNull(v)) return false;
        String s = v.trim();
        if (!ALPHA_SPACE.matcher(s).matches()) return false;
        String[] parts = WS.split(s);
        if (parts.length < 2) return false;
        for (String p : parts) {
            if (p.length() < 2) return false;
        }
        return true;
    }

    public static boolean validLoanAmount(String v) {
        return inRange(v, LOAN_MIN, LOAN_MAX);
    }

    public static boolean validMonthlyIncome(String v) {
        return inRange(v, INCOME_MIN, INCOME_MAX);
    }

    public static boolean validLoanPurpose(String v) {
        return !isNull(v) && LoanPurpose.fromTerm(v).isPresent();
    }

    public static boolean validEmploymentType(String v) {
        return !isNull(v) && EmploymentType.fromTerm(v).isPresent();
    }

    private static boolean inRange(String v, long min, long max) {
        if (isNull(v)) return false;
        try {
            long n = Long.parseLong(v.trim());
            return n >= min && n <= max;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
