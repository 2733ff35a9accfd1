package com.dnobretech.loaningestor.intake;

import com.dnobretech.loaningestor.enums.EmploymentType;
import com.dnobretech.loaningestor.enums.LoanPurpose;
import com.dnobretech.loaningestor.util.ValueNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifica cada valor cru da linha num único balde, pelo formato do próprio valor
 * (a posição da coluna não importa aqui). Valores que não casam com nada são descartados.
 */
@Slf4j
@Component
public class ValueClassifier {

    private static final Pattern DIGITS = Pattern.compile("^[0-9]+$");
    private static final Pattern NAME_LIKE = Pattern.compile("^[A-Za-z ]{3,}$");

    public ValueBuckets classify(List<String> rawValues) {
        ValueBuckets buckets = new ValueBuckets();
        for (String v : rawValues) {
            if (FieldValidators.isNull(v)) continue;
            classifyOne(v.trim(), buckets);
        }
        return buckets;
    }

    private void classifyOne(String v, ValueBuckets buckets) {
        if (FieldValidators.validId(v)) {
            buckets.add(ValueBucket.ID, v);
            return;
        }
        if (FieldValidators.validEmail(v)) {
            buckets.add(ValueBucket.EMAIL, v);
            return;
        }
        if (FieldValidators.validPan(v)) {
            buckets.add(ValueBucket.PAN, v.toUpperCase(Locale.ROOT));
            return;
        }
        if (FieldValidators.validAadhaar(v)) {
            buckets.add(ValueBucket.AADHAAR, v);
            return;
        }
        if (FieldValidators.validPhone(v)) {
            buckets.add(ValueBucket.PHONE, v);
            return;
        }
        Optional<EmploymentType> employment = EmploymentType.fromTerm(v);
        if (employment.isPresent()) {
            buckets.add(ValueBucket.EMPLOYMENT, employment.get().label());
            return;
        }
        Optional<LoanPurpose> purpose = LoanPurpose.fromTerm(v);
        if (purpose.isPresent()) {
            buckets.add(ValueBucket.PURPOSE, purpose.get().label());
            return;
        }
        if (DIGITS.matcher(v).matches()) {
            try {
                buckets.addNumber(v, Long.parseLong(v));
            } catch (NumberFormatException e) {
                // mais de 18 dígitos: não é valor nem renda
                log.debug("valor numérico fora de faixa descartado: {}", v);
            }
            return;
        }
        if (NAME_LIKE.matcher(v).matches()) {
            buckets.add(ValueBucket.NAME, ValueNormalizer.titleCase(v));
        }
    }
}
