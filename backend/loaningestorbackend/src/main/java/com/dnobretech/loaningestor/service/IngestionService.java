package com.dnobretech.loaningestor.service;

import com.dnobretech.loaningestor.dto.PreviewResponse;
import com.dnobretech.loaningestor.dto.UploadResponse;
import org.springframework.web.multipart.MultipartFile;

public interface IngestionService {
    PreviewResponse preview(MultipartFile file);
    UploadResponse upload(MultipartFile file);
}
