package io.dectree.service.view;

public record TreeLine(int depth, NodeView node) {}
