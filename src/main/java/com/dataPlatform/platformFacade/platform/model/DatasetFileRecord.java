package com.dataPlatform.platformFacade.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatasetFileRecord {

    private String name;
    private ByteSize size;
    private Instant creationDate;
}
