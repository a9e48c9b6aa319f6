/**
 * DeleteNodeRequest.java
 *
 * 删除一个节点；target 省略时删除当前选中的节点。
 */
package club.ppmc.visualsync.model.request;

import club.ppmc.visualsync.model.NodeRef;
import jakarta.validation.Valid;

public record DeleteNodeRequest(@Valid NodeRef target) {}
