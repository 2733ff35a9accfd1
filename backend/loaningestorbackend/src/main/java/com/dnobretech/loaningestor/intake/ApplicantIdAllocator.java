package com.dnobretech.loaningestor.intake;

import com.dnobretech.loaningestor.repository.LoanApplicantRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Abre o contexto de ids de um lote. A leitura do banco acontece uma única vez aqui,
 * antes de qualquer reparo; se falhar, o lote segue só com o conhecimento local.
 */
@Slf4j
@Component
public class ApplicantIdAllocator {

    private final LoanApplicantRepository repo;
    private final long firstId;

    public ApplicantIdAllocator(LoanApplicantRepository repo,
                                @Value("${loan.ids.start:101}") long firstId) {
        this.repo = repo;
        this.firstId = firstId;
    }

    public BatchIdentifierContext openBatch() {
        Set<Long> seeded = readStoreIds();
        log.info("[ids] {} ids existentes no banco", seeded.size());
        return new BatchIdentifierContext(seeded, firstId);
    }

    private Set<Long> readStoreIds() {
        Set<Long> out = new HashSet<>();
        try {
            List<String> ids = repo.findAllApplicantIds();
            for (String id : ids) {
                Long n = BatchIdentifierContext.suffix(id);
                if (n != null) out.add(n);
            }
        } catch (Exception e) {
            log.warn("[ids] falha ao ler ids do banco, usando apenas ids do lote: {}", e.toString());
            return Set.of();
        }
        return out;
    }
}
