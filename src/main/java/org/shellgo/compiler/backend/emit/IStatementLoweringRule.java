package org.shellgo.compiler.backend.emit;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.ir.IrStatement;

/**
 * Lowers one kind of IR statement to Go statements.
 *
 * @param <T> The statement type handled.
 */
public interface IStatementLoweringRule<T extends IrStatement> {

	/**
	 * Writes the Go statements for the given IR statement.
	 *
	 * @param statement The statement to lower.
	 * @param out       The code being written.
	 * @param ctx       The emit context.
	 * @throws UnsupportedConstructException if the statement cannot be lowered faithfully.
	 */
	void lower(T statement, CodeBuilder out, EmitContext ctx) throws UnsupportedConstructException;
}
