package org.javai.dygram.condition;

record ConditionToken(Type type, String text, int position) {

	enum Type {
		IDENTIFIER,
		NUMBER,
		STRING,
		DOT,
		LPAREN,
		RPAREN,
		NOT,
		AND,
		OR,
		EQ,
		NE,
		LT,
		LE,
		GT,
		GE,
		EOF
	}
}
