package com.hockeyfeed.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.With;

/**
 * Article URL found on a listing page, with the tile thumbnail if the tile had one.
 */
@Value
@AllArgsConstructor
public class ListingCandidate {
    String originUrl;
    @With
    String imageUrl;
}
