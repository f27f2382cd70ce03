package com.flamingo.ndthub.service.document;

import com.flamingo.ndthub.domain.entity.Document;
import com.flamingo.ndthub.domain.entity.Section;
import java.util.List;

/**
 * A document together with its sections in order.
 *
 * @param document the document
 * @param sections its sections by order index
 */
public record DocumentDetail(Document document, List<Section> sections) {}
