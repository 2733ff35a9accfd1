package com.dnobretech.loaningestor.intake;

import java.util.HashSet;
import java.util.Set;

/**
 * Identificadores conhecidos durante um lote: os lidos do banco no início do lote
 * mais os alocados/observados no próprio lote. Nunca é persistido; o banco volta a ser
 * a fonte da verdade no lote seguinte.
 *
 * register/allocateNext são sincronizados: alocação concorrente sem trava emite ids duplicados.
 */
public class BatchIdentifierContext {

    private final Set<Long> storeIds;
    private final Set<Long> batchIds = new HashSet<>();
    private final long storeMax;
    private long batchMax;

    public BatchIdentifierContext(Set<Long> storeIds, long firstId) {
        this.storeIds = Set.copyOf(storeIds);
        long max = firstId - 1;
        for (long n : this.storeIds) max = Math.max(max, n);
        this.storeMax = max;
        this.batchMax = max;
    }

    /** estado CLEARED: esquece o que foi alocado/observado no lote */
    public synchronized void clear() {
        batchIds.clear();
        batchMax = storeMax;
    }

    /**
     * Registra um id já existente (válido) para que o alocador não o reemita.
     * Devolve false se o valor não tem o formato A&lt;n&gt;.
     */
    public synchronized boolean register(String applicantId) {
        Long n = suffix(applicantId);
        if (n == null) return false;
        batchIds.add(n);
        batchMax = Math.max(batchMax, n);
        return true;
    }

    /**
     * Próximo id acima do maior sufixo já visto (banco + lote); começa em firstId se não houver nenhum.
     * Um número alocado nunca volta a ser emitido no mesmo lote.
     */
    public synchronized String allocateNext() {
        long next = batchMax + 1;
        while (storeIds.contains(next) || batchIds.contains(next)) next++;
        batchIds.add(next);
        batchMax = next;
        return "A" + next;
    }

    public synchronized boolean isKnown(String applicantId) {
        Long n = suffix(applicantId);
        return n != null && (storeIds.contains(n) || batchIds.contains(n));
    }

    public synchronized int batchSize() {
        return batchIds.size();
    }

    static Long suffix(String applicantId) {
        if (!FieldValidators.validId(applicantId)) return null;
        try {
            return Long.parseLong(applicantId.trim().substring(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
