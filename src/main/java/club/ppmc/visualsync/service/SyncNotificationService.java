/**
 * SyncNotificationService.java
 *
 * 同步引擎与前端之间唯一的 WebSocket 出口。
 * 它实现 SyncListener，把编排器的五个通知通道序列化为 JSON 后广播到 /topic/sync/* 主题，
 * 可视化渲染器、属性面板和代码编辑器各自订阅需要的主题。
 */
package club.ppmc.visualsync.service;

import club.ppmc.visualsync.engine.sync.SyncListener;
import club.ppmc.visualsync.model.Selection;
import club.ppmc.visualsync.model.SourceBuffer;
import club.ppmc.visualsync.model.SyncEvent;
import club.ppmc.visualsync.model.tree.RootNode;
import club.ppmc.visualsync.model.value.AttributeValue;
import com.google.gson.Gson;
import java.util.Map;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class SyncNotificationService implements SyncListener {

    public static final String SELECTION_TOPIC = "/topic/sync/selection";
    public static final String ATTRIBUTES_TOPIC = "/topic/sync/attributes";
    public static final String CODE_TOPIC = "/topic/sync/code";
    public static final String EVENTS_TOPIC = "/topic/sync/events";
    public static final String TREE_TOPIC = "/topic/sync/tree";

    private final SimpMessagingTemplate messagingTemplate;
    private final Gson gson;

    public SyncNotificationService(SimpMessagingTemplate messagingTemplate, Gson gson) {
        this.messagingTemplate = messagingTemplate;
        this.gson = gson;
    }

    /** 清除选区时推送 JSON null。 */
    @Override
    public void onSelectionChanged(Selection selection) {
        sendMessage(SELECTION_TOPIC, gson.toJson(selection));
    }

    @Override
    public void onAttributesChanged(Map<String, AttributeValue> attributes) {
        sendMessage(ATTRIBUTES_TOPIC, gson.toJson(attributes));
    }

    @Override
    public void onCodeChanged(SourceBuffer buffer) {
        sendMessage(CODE_TOPIC, gson.toJson(buffer));
    }

    @Override
    public void onSyncEvent(SyncEvent event) {
        sendMessage(EVENTS_TOPIC, gson.toJson(event));
    }

    @Override
    public void onTreeChanged(RootNode root) {
        sendMessage(TREE_TOPIC, gson.toJson(root));
    }

    /**
     * 向指定主题发送已经序列化好的载荷。
     */
    public void sendMessage(String destination, Object payload) {
        messagingTemplate.convertAndSend(destination, payload);
    }
}
