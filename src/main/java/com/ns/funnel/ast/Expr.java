package com.ns.funnel.ast;

public abstract class Expr extends Node {
}
