package org.shellgo.compiler.backend.emit;

import org.shellgo.compiler.api.UnsupportedConstructException;
import org.shellgo.compiler.backend.emit.rules.AssignmentLoweringRule;
import org.shellgo.compiler.backend.emit.rules.BackgroundLoweringRule;
import org.shellgo.compiler.backend.emit.rules.CommandLoweringRule;
import org.shellgo.compiler.backend.emit.rules.ConditionalLoweringRule;
import org.shellgo.compiler.backend.emit.rules.FunctionDeclLoweringRule;
import org.shellgo.compiler.backend.emit.rules.LoopLoweringRule;
import org.shellgo.compiler.backend.emit.rules.PipelineLoweringRule;
import org.shellgo.compiler.backend.emit.rules.RedirectionLoweringRule;
import org.shellgo.compiler.backend.emit.rules.ReturnLoweringRule;
import org.shellgo.compiler.backend.emit.rules.SubshellLoweringRule;
import org.shellgo.compiler.ir.IrAssignment;
import org.shellgo.compiler.ir.IrBackground;
import org.shellgo.compiler.ir.IrCommand;
import org.shellgo.compiler.ir.IrConditional;
import org.shellgo.compiler.ir.IrFunctionDecl;
import org.shellgo.compiler.ir.IrLoop;
import org.shellgo.compiler.ir.IrPipeline;
import org.shellgo.compiler.ir.IrRedirection;
import org.shellgo.compiler.ir.IrReturn;
import org.shellgo.compiler.ir.IrStatement;
import org.shellgo.compiler.ir.IrSubshell;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry of lowering rules, one per statement type. The table is fixed when the
 * generator is created; a statement without a rule aborts generation.
 */
public final class LoweringRegistry {

	private final Map<Class<? extends IrStatement>, IStatementLoweringRule<? extends IrStatement>> rules = new HashMap<>();

	/**
	 * Registers the rule for a statement type, replacing an earlier one.
	 * @param type The statement class.
	 * @param rule The rule.
	 * @param <T> The statement type.
	 */
	public <T extends IrStatement> void register(Class<T> type, IStatementLoweringRule<T> rule) {
		rules.put(type, rule);
	}

	/**
	 * @param statement The statement to lower.
	 * @return The rule for its type.
	 * @throws UnsupportedConstructException if no rule is registered.
	 */
	@SuppressWarnings("unchecked")
	public IStatementLoweringRule<IrStatement> resolve(IrStatement statement) throws UnsupportedConstructException {
		IStatementLoweringRule<?> rule = rules.get(statement.getClass());
		if (rule == null) {
			throw new UnsupportedConstructException("statement kind " + statement.kind(), statement.source());
		}
		return (IStatementLoweringRule<IrStatement>) rule;
	}

	/**
	 * Initializes a new registry with a rule for every statement kind.
	 * @return A new registry with default rules.
	 */
	public static LoweringRegistry initializeWithDefaults() {
		LoweringRegistry reg = new LoweringRegistry();
		reg.register(IrCommand.class, new CommandLoweringRule());
		reg.register(IrAssignment.class, new AssignmentLoweringRule());
		reg.register(IrConditional.class, new ConditionalLoweringRule());
		reg.register(IrLoop.class, new LoopLoweringRule());
		reg.register(IrPipeline.class, new PipelineLoweringRule());
		reg.register(IrSubshell.class, new SubshellLoweringRule());
		reg.register(IrRedirection.class, new RedirectionLoweringRule());
		reg.register(IrBackground.class, new BackgroundLoweringRule());
		reg.register(IrReturn.class, new ReturnLoweringRule());
		reg.register(IrFunctionDecl.class, new FunctionDeclLoweringRule());
		return reg;
	}
}
