package com.spreadsheet.engine.fill;

import com.spreadsheet.engine.exceptions.InvalidOperationException;
import com.spreadsheet.engine.models.Cell;
import com.spreadsheet.engine.models.CellAddress;
import com.spreadsheet.engine.models.CellRange;
import com.spreadsheet.engine.models.CellValue;
import com.spreadsheet.engine.repository.CellRepository;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes what a fill writes. Nothing here touches the repository; the caller commits the result.
 *
 * Works lane by lane: each column of the target for UP/DOWN, each row for LEFT/RIGHT.
 * Within a lane the source is read in fill order, a pattern is detected (unless one was
 * forced) and continued into the target cells, nearest first.
 */
public class FillEngine {

    private final CellRepository repository;
    private final FormulaAdjuster formulaAdjuster;
    private final List<PatternDetector> detectors;

    public FillEngine(CellRepository repository, FormulaAdjuster formulaAdjuster) {
        this(repository, formulaAdjuster, Arrays.asList(
                new LinearPatternDetector(),
                new ExponentialPatternDetector(),
                new DatePatternDetector(),
                new TextPatternDetector(),
                new CopyPatternDetector()));
    }

    public FillEngine(CellRepository repository, FormulaAdjuster formulaAdjuster, List<PatternDetector> detectors) {
        this.repository = repository;
        this.formulaAdjuster = formulaAdjuster;
        this.detectors = new ArrayList<>(detectors);
        this.detectors.sort(Comparator.comparingInt(PatternDetector::getPriority).reversed());
    }

    public FillResult fill(FillOperation operation) {
        CellRange source = operation.getSourceRange();
        CellRange target = operation.getTargetRange();
        FillDirection direction = operation.getDirection();
        checkLanes(source, target, direction);

        Map<CellAddress, CellValue> values = new HashMap<>();
        Map<CellAddress, String> formulas = new HashMap<>();
        int laneCount = direction.isVertical() ? source.columnCount() : source.rowCount();
        for (int lane = 0; lane < laneCount; lane++) {
            List<CellAddress> sourceCells = lane(source, direction, lane);
            List<CellAddress> targetCells = lane(target, direction, lane);

            List<CellValue> sourceValues = new ArrayList<>(sourceCells.size());
            for (CellAddress address : sourceCells) {
                sourceValues.add(repository.get(address).map(Cell::getComputedValue).orElse(CellValue.EMPTY));
            }
            PatternType pattern = operation.getPattern() != null
                    ? operation.getPattern()
                    : detectPattern(sourceValues);
            List<CellValue> generated = detectorFor(pattern).generate(sourceValues, pattern, targetCells.size());

            for (int i = 0; i < targetCells.size(); i++) {
                CellAddress from = sourceCells.get(i % sourceCells.size());
                CellAddress to = targetCells.get(i);
                Optional<Cell> sourceCell = repository.get(from);
                if (sourceCell.isPresent() && sourceCell.get().hasFormula()) {
                    formulas.put(to, formulaAdjuster.adjustFormula(sourceCell.get().getRawText(), from, to));
                } else {
                    values.put(to, generated.get(i));
                }
            }
        }
        return new FillResult(values, formulas);
    }

    /**
     * First detector, by priority, that handles the values and finds its pattern in them.
     */
    public PatternType detectPattern(List<CellValue> values) {
        for (PatternDetector detector : detectors) {
            if (detector.canHandle(values)) {
                Optional<PatternType> pattern = detector.detect(values);
                if (pattern.isPresent()) {
                    return pattern.get();
                }
            }
        }
        return PatternType.copy();
    }

    private PatternDetector detectorFor(PatternType pattern) {
        for (PatternDetector detector : detectors) {
            if (detector.getKind() == pattern.getKind()) {
                return detector;
            }
        }
        throw new InvalidOperationException("No generator for pattern " + pattern);
    }

    private static void checkLanes(CellRange source, CellRange target, FillDirection direction) {
        if (direction == null) {
            throw new InvalidOperationException("Fill direction is required");
        }
        boolean sameLanes = direction.isVertical()
                ? source.getStart().getCol() == target.getStart().getCol()
                        && source.getEnd().getCol() == target.getEnd().getCol()
                : source.getStart().getRow() == target.getStart().getRow()
                        && source.getEnd().getRow() == target.getEnd().getRow();
        if (!sameLanes) {
            throw new InvalidOperationException("Fill " + direction + " from " + source.toA1() + " to "
                    + target.toA1() + ": source and target must span the same "
                    + (direction.isVertical() ? "columns" : "rows"));
        }
    }

    // Cells of one lane in fill order
    private static List<CellAddress> lane(CellRange range, FillDirection direction, int lane) {
        List<CellAddress> cells = new ArrayList<>();
        if (direction.isVertical()) {
            int col = range.getStart().getCol() + lane;
            for (int row = range.getStart().getRow(); row <= range.getEnd().getRow(); row++) {
                cells.add(new CellAddress(col, row));
            }
        } else {
            int row = range.getStart().getRow() + lane;
            for (int col = range.getStart().getCol(); col <= range.getEnd().getCol(); col++) {
                cells.add(new CellAddress(col, row));
            }
        }
        if (direction.isReversed()) {
            Collections.reverse(cells);
        }
        return cells;
    }
}
