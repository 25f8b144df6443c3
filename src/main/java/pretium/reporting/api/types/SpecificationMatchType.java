package pretium.reporting.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One specification chunk returned by the project knowledge search.
 *
 * @param content
 *            chunk text
 * @param similarity
 *            cosine similarity in [0, 1]
 * @param chunkIndex
 *            position of the chunk in its document
 * @param knowledgeId
 *            id of the uploaded document
 * @param fileName
 *            original file name of the document
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpecificationMatchType(String content, double similarity, Integer chunkIndex, String knowledgeId,
        String fileName) {
}
