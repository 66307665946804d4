/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.atomizer.fdo.model;

import com.atomizer.fdo.symbol.AtomRole;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed atom stream: top-level nodes in source order, bounded by the root
 * start-stream and end-stream atoms.
 */
public record AtomTree(List<AtomNode> roots) {

    public AtomTree {
        roots = List.copyOf(roots);
    }

    /**
     * All atoms depth-first in document order (the order they appear in the source).
     */
    public List<AtomNode> flatten() {
        List<AtomNode> out = new ArrayList<>();
        for (AtomNode root : roots) {
            collect(root, out);
        }
        return out;
    }

    private static void collect(AtomNode node, List<AtomNode> out) {
        out.add(node);
        for (AtomNode child : node.children()) {
            collect(child, out);
        }
    }

    public int size() {
        return flatten().size();
    }

    /**
     * Number of atoms with the given structural role.
     */
    public long count(AtomRole role) {
        return flatten().stream().filter(n -> n.definition().role() == role).count();
    }

    /**
     * Renders the tree back to source text, two spaces per indentation level.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (AtomNode root : roots) {
            render(root, 0, sb);
        }
        return sb.toString();
    }

    private static void render(AtomNode node, int level, StringBuilder sb) {
        sb.append("  ".repeat(level)).append(node).append('\n');
        for (AtomNode child : node.children()) {
            render(child, level + 1, sb);
        }
    }
}
