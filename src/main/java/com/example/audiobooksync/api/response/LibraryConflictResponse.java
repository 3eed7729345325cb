package com.example.audiobooksync.api.response;

import com.example.audiobooksync.domain.model.LibraryFingerprint;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LibraryConflictResponse {

    private LibraryFingerprint stored;

    private LibraryFingerprint current;
}
