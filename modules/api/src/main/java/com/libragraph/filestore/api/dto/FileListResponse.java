package com.libragraph.filestore.api.dto;

import com.libragraph.filestore.types.FilePage;

import java.util.List;

public record FileListResponse(List<FileDetailsResponse> files, boolean morePages) {

    public static FileListResponse from(FilePage page) {
        return new FileListResponse(
                page.files().stream().map(FileDetailsResponse::from).toList(),
                page.morePages());
    }
}
