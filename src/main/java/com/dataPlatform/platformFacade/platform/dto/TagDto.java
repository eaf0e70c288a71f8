package com.dataPlatform.platformFacade.platform.dto;

import com.dataPlatform.platformFacade.platform.model.PlatformTag;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TagDto {

    private String ref;
    private String name;

    public PlatformTag toTag() {
        return new PlatformTag(ref, name);
    }

    static List<PlatformTag> toTags(List<TagDto> tags) {
        if (tags == null) {
            return List.of();
        }
        return tags.stream().map(TagDto::toTag).toList();
    }
}
