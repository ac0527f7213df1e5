package com.eyelevel.docpipeline.service.processor.ocr;

import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.EntityType;
import software.amazon.awssdk.services.textract.model.Relationship;
import software.amazon.awssdk.services.textract.model.RelationshipType;
import software.amazon.awssdk.services.textract.model.SelectionStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Turns Textract blocks into an {@link OcrResult}.
 * <p>
 * Lines are ordered by page, then by vertical position (tops within 0.01 count as one row), then left to right.
 */
public class TextractResultParser {

    private static final double ROW_TOLERANCE = 0.01;

    public OcrResult parse(List<Block> blocks) {
        Map<String, Block> blocksById = new HashMap<>();
        for (Block block : blocks) {
            if (block.id() != null) {
                blocksById.put(block.id(), block);
            }
        }

        List<Block> lines = blocks.stream()
                .filter(block -> block.blockType() == BlockType.LINE)
                .sorted(readingOrder())
                .toList();
        String text = lines.stream()
                .map(Block::text)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n"));

        int wordCount = (int) blocks.stream().filter(block -> block.blockType() == BlockType.WORD).count();
        double confidence = blocks.stream()
                .map(Block::confidence)
                .filter(Objects::nonNull)
                .mapToDouble(Float::doubleValue)
                .average()
                .orElse(0);
        int pageCount = (int) Math.max(1, blocks.stream()
                .map(Block::page)
                .filter(Objects::nonNull)
                .distinct()
                .count());
        int signatureCount = (int) blocks.stream()
                .filter(block -> block.blockType() == BlockType.SIGNATURE)
                .count();

        return OcrResult.builder()
                .text(text)
                .pageCount(pageCount)
                .wordCount(wordCount)
                .confidence(confidence)
                .tables(extractTables(blocks, blocksById))
                .formFields(extractFormFields(blocks, blocksById))
                .signatureCount(signatureCount)
                .build();
    }

    private List<OcrTable> extractTables(List<Block> blocks, Map<String, Block> blocksById) {
        List<OcrTable> tables = new ArrayList<>();
        for (Block table : blocks) {
            if (table.blockType() != BlockType.TABLE) {
                continue;
            }
            List<Block> cells = childrenOf(table, blocksById).stream()
                    .filter(child -> child.blockType() == BlockType.CELL)
                    .toList();
            int rowCount = cells.stream().mapToInt(cell -> valueOf(cell.rowIndex())).max().orElse(0);
            int columnCount = cells.stream().mapToInt(cell -> valueOf(cell.columnIndex())).max().orElse(0);

            List<List<String>> rows = new ArrayList<>(rowCount);
            for (int r = 0; r < rowCount; r++) {
                List<String> row = new ArrayList<>(columnCount);
                for (int c = 0; c < columnCount; c++) {
                    row.add("");
                }
                rows.add(row);
            }
            for (Block cell : cells) {
                int row = valueOf(cell.rowIndex()) - 1;
                int column = valueOf(cell.columnIndex()) - 1;
                if (row >= 0 && column >= 0) {
                    rows.get(row).set(column, wordsOf(cell, blocksById));
                }
            }

            double confidence = cells.stream()
                    .map(Block::confidence)
                    .filter(Objects::nonNull)
                    .mapToDouble(Float::doubleValue)
                    .average()
                    .orElse(0);
            tables.add(new OcrTable(table.id(), valueOf(table.page()), rowCount, columnCount, rows, confidence));
        }
        return tables;
    }

    private List<OcrFormField> extractFormFields(List<Block> blocks, Map<String, Block> blocksById) {
        List<OcrFormField> fields = new ArrayList<>();
        for (Block block : blocks) {
            if (block.blockType() != BlockType.KEY_VALUE_SET || !block.entityTypes().contains(EntityType.KEY)) {
                continue;
            }
            String key = wordsOf(block, blocksById).trim();
            if (key.isEmpty()) {
                continue;
            }
            String value = "";
            for (Relationship relationship : block.relationships()) {
                if (relationship.type() == RelationshipType.VALUE && !relationship.ids().isEmpty()) {
                    Block valueBlock = blocksById.get(relationship.ids().get(0));
                    if (valueBlock != null) {
                        value = wordsOf(valueBlock, blocksById).trim();
                    }
                    break;
                }
            }
            double confidence = block.confidence() != null ? block.confidence() : 0;
            fields.add(new OcrFormField(key, value, confidence, valueOf(block.page())));
        }
        return fields;
    }

    private String wordsOf(Block block, Map<String, Block> blocksById) {
        List<String> parts = new ArrayList<>();
        for (Block child : childrenOf(block, blocksById)) {
            if (child.blockType() == BlockType.WORD && child.text() != null) {
                parts.add(child.text());
            } else if (child.blockType() == BlockType.SELECTION_ELEMENT) {
                parts.add(child.selectionStatus() == SelectionStatus.SELECTED ? "[X]" : "[ ]");
            }
        }
        return String.join(" ", parts);
    }

    private List<Block> childrenOf(Block block, Map<String, Block> blocksById) {
        List<Block> children = new ArrayList<>();
        for (Relationship relationship : block.relationships()) {
            if (relationship.type() != RelationshipType.CHILD) {
                continue;
            }
            for (String id : relationship.ids()) {
                Block child = blocksById.get(id);
                if (child != null) {
                    children.add(child);
                }
            }
        }
        return children;
    }

    private static Comparator<Block> readingOrder() {
        return (a, b) -> {
            int byPage = Integer.compare(valueOf(a.page()), valueOf(b.page()));
            if (byPage != 0) {
                return byPage;
            }
            double topA = top(a);
            double topB = top(b);
            if (Math.abs(topA - topB) > ROW_TOLERANCE) {
                return Double.compare(topA, topB);
            }
            return Double.compare(left(a), left(b));
        };
    }

    private static double top(Block block) {
        return block.geometry() != null && block.geometry().boundingBox() != null
                && block.geometry().boundingBox().top() != null ? block.geometry().boundingBox().top() : 0;
    }

    private static double left(Block block) {
        return block.geometry() != null && block.geometry().boundingBox() != null
                && block.geometry().boundingBox().left() != null ? block.geometry().boundingBox().left() : 0;
    }

    private static int valueOf(Integer value) {
        return value == null ? 0 : value;
    }
}
