/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.encode;

import com.atomizer.fdo.model.AtomNode;
import com.atomizer.fdo.model.AtomTree;
import com.atomizer.fdo.model.EncodedStream;
import com.atomizer.fdo.model.Variant;
import com.atomizer.fdo.spi.FdoCompilationException;
import com.atomizer.fdo.symbol.AtomDefinition;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * Default production strategy, built from the atom forms observed in reference streams.
 *
 * <p>The root start-stream atom is implied by the header and dropped when it carries its
 * default data. Every other atom takes the first form that applies: zero-data (style 2),
 * short (style 1), same-protocol (style 4), otherwise full (style 0). Arguments use their
 * production widths.</p>
 *
 * <p>Reference streams also use forms this strategy never emits (large-atom segmentation,
 * styles 3, 5, 6 and 7); the differential validator reports where output diverges.</p>
 */
public final class StyledCompactionStrategy implements EncodingStrategy {

    public static final String NAME = "styled";

    @Override
    public Variant variant() {
        return Variant.PRODUCTION;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public EncodedStream encode(AtomTree tree, ArgumentEncoder arguments) throws FdoCompilationException {
        List<AtomNode> atoms = tree.flatten();
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int start = 0;
        if (!atoms.isEmpty()) {
            byte[] rootData = arguments.encode(atoms.get(0), Variant.PRODUCTION);
            if (ProductionFormat.rootIsImplied(atoms, rootData, arguments)) {
                start = 1;
            }
        }

        // Protocol of the previous atom; the implied root belongs to protocol 0.
        int currentProtocol = 0;
        for (AtomNode node : atoms.subList(start, atoms.size())) {
            AtomDefinition def = node.definition();
            byte[] data = arguments.encode(node, Variant.PRODUCTION);

            if (ProductionFormat.isZeroData(data)) {
                ProductionFormat.writeZero(out, def);
            } else if (data.length <= ProductionFormat.MAX_SHORT_LENGTH
                    && def.atom() <= ProductionFormat.MAX_SHORT_ATOM) {
                ProductionFormat.writeShort(out, def, data);
            } else if (def.protocol() == currentProtocol
                    && def.atom() <= ProductionFormat.MAX_SHORT_ATOM
                    && data.length <= ProductionFormat.MAX_ONE_BYTE_LENGTH) {
                ProductionFormat.writeCurrent(out, def, data);
            } else {
                ProductionFormat.writeFull(out, def, data, node);
            }
            currentProtocol = def.protocol();
        }
        return EncodedStream.of(Variant.PRODUCTION, out.toByteArray());
    }
}
