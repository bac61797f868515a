package org.javai.srilang.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A call. When {@code func} is a plain {@link NameNode} the call may be a
 * builtin that can be folded through the builtin registry.
 */
public final class CallNode extends SriNode {

	public static final NodeType<CallNode> TYPE = NodeType.builder("Call", CallNode.class, CallNode::new)
			.node("func", n -> n.func, (n, v) -> n.func = v)
			.nodeList("args", n -> n.args)
			.nodeList("keywords", n -> n.keywords)
			.node("keyword", n -> n.keyword, (n, v) -> n.keyword = v)
			.build();

	private SriNode func;
	private final List<SriNode> args = new ArrayList<>();
	private final List<SriNode> keywords = new ArrayList<>();
	private SriNode keyword;

	CallNode(SriNode parent, SourceSpan span) {
		super(parent, span);
	}

	public SriNode func() {
		return func;
	}

	public List<SriNode> args() {
		return Collections.unmodifiableList(args);
	}

	public List<SriNode> keywords() {
		return Collections.unmodifiableList(keywords);
	}

	public SriNode keyword() {
		return keyword;
	}

	/**
	 * Name of the callee when it is an unqualified name, otherwise {@code null}.
	 */
	public String calleeName() {
		return func instanceof NameNode name ? name.id() : null;
	}

	@Override
	public NodeType<CallNode> nodeType() {
		return TYPE;
	}
}
