package com.dnobretech.loaningestor.controller;

import com.dnobretech.loaningestor.dto.PreviewResponse;
import com.dnobretech.loaningestor.dto.UploadResponse;
import com.dnobretech.loaningestor.service.IngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;

    // só repara e devolve as primeiras linhas; não grava nada
    @PostMapping(value = "/validate", consumes = "multipart/form-data")
    public PreviewResponse validate(@RequestPart("file") MultipartFile file) {
        return ingestionService.preview(file);
    }

    @PostMapping(value = "/upload", consumes = "multipart/form-data")
    public UploadResponse upload(@RequestPart("file") MultipartFile file) {
        return ingestionService.upload(file);
    }
}
