package io.github.drompincen.iterablemcp.runtime.policy;

import io.github.drompincen.iterablemcp.protocol.api.ToolCapability;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Static classification of tool names into capability safe-lists.
 * <p>
 * Membership is hand-curated. A name missing from a set fails the gate that set
 * guards, so a tool added without a classification ends up more restricted, never less.
 */
public final class CapabilityTaxonomy {

    /** Tools that never return user-identifying data. */
    private static final Set<String> NON_PII = Set.of(
            "abort_campaign",
            "activate_triggered_campaign",
            "archive_campaigns",
            "bulk_delete_catalog_items",
            "cancel_campaign",
            "create_campaign",
            "create_catalog",
            "create_list",
            "create_snippet",
            "deactivate_triggered_campaign",
            "delete_catalog",
            "delete_catalog_item",
            "delete_list",
            "delete_snippet",
            "delete_templates",
            "get_campaign",
            "get_campaign_metrics",
            "get_campaigns",
            "get_catalog_field_mappings",
            "get_catalog_item",
            "get_catalog_items",
            "get_catalogs",
            "get_channels",
            "get_child_campaigns",
            "get_email_template",
            "get_experiment_metrics",
            "get_inapp_template",
            "get_journeys",
            "get_list_size",
            "get_lists",
            "get_message_types",
            "get_push_template",
            "get_sms_template",
            "get_snippet",
            "get_snippets",
            "get_template_by_client_id",
            "get_templates",
            "get_user_fields",
            "get_webhooks",
            "partial_update_catalog_item",
            "preview_email_template",
            "preview_inapp_template",
            "replace_catalog_item",
            "schedule_campaign",
            "send_campaign",
            "trigger_campaign",
            "update_catalog_field_mappings",
            "update_catalog_items",
            "update_email_template",
            "update_inapp_template",
            "update_push_template",
            "update_sms_template",
            "update_snippet",
            "update_webhook",
            "upsert_email_template",
            "upsert_inapp_template",
            "upsert_push_template",
            "upsert_sms_template");

    /** Tools that only read upstream state. */
    private static final Set<String> READ_ONLY = Set.of(
            "get_campaign",
            "get_campaign_metrics",
            "get_campaigns",
            "get_catalog_field_mappings",
            "get_catalog_item",
            "get_catalog_items",
            "get_catalogs",
            "get_channels",
            "get_child_campaigns",
            "get_email_template",
            "get_embedded_messages",
            "get_experiment_metrics",
            "get_export_files",
            "get_export_jobs",
            "get_in_app_messages",
            "get_inapp_template",
            "get_journeys",
            "get_list_preview_users",
            "get_list_size",
            "get_list_users",
            "get_lists",
            "get_message_types",
            "get_push_template",
            "get_sent_messages",
            "get_sms_template",
            "get_snippet",
            "get_snippets",
            "get_template_by_client_id",
            "get_templates",
            "get_user_by_email",
            "get_user_by_user_id",
            "get_user_events_by_email",
            "get_user_events_by_user_id",
            "get_user_fields",
            "get_webhooks",
            "preview_email_template",
            "preview_inapp_template");

    /** Tools that can dispatch a message, directly or through a campaign, journey or event. */
    private static final Set<String> SEND = Set.of(
            // campaign sends and enablers
            "send_campaign",
            "trigger_campaign",
            "schedule_campaign",
            "create_campaign",
            "activate_triggered_campaign",
            "trigger_journey",
            // events may drive sends
            "track_event",
            "track_bulk_events",
            // direct messaging
            "send_email",
            "send_sms",
            "send_whatsapp",
            "send_web_push",
            "send_push",
            "send_in_app",
            // template proofs
            "send_email_template_proof",
            "send_sms_template_proof",
            "send_push_template_proof",
            "send_inapp_template_proof");

    /** PII-bearing write tools: known names that sit in none of the safe-lists. */
    private static final Set<String> UNCLASSIFIED_KNOWN = Set.of(
            "bulk_update_users",
            "delete_user_by_email",
            "delete_user_by_user_id",
            "subscribe_to_list",
            "track_purchase",
            "unsubscribe_from_list",
            "update_cart",
            "update_email",
            "update_user",
            "update_user_subscriptions");

    private static final Set<String> KNOWN = union(NON_PII, READ_ONLY, SEND, UNCLASSIFIED_KNOWN);

    private CapabilityTaxonomy() {}

    public static boolean isNonPii(String toolName) {
        return toolName != null && NON_PII.contains(toolName);
    }

    public static boolean isReadOnly(String toolName) {
        return toolName != null && READ_ONLY.contains(toolName);
    }

    public static boolean isSend(String toolName) {
        return toolName != null && SEND.contains(toolName);
    }

    public static boolean isKnown(String toolName) {
        return toolName != null && KNOWN.contains(toolName);
    }

    public static Set<ToolCapability> capabilitiesOf(String toolName) {
        Set<ToolCapability> capabilities = EnumSet.noneOf(ToolCapability.class);
        if (isNonPii(toolName)) capabilities.add(ToolCapability.NON_PII);
        if (isReadOnly(toolName)) capabilities.add(ToolCapability.READ_ONLY);
        if (isSend(toolName)) capabilities.add(ToolCapability.SEND);
        return capabilities;
    }

    public static Set<String> nonPiiTools() {
        return NON_PII;
    }

    public static Set<String> readOnlyTools() {
        return READ_ONLY;
    }

    public static Set<String> sendTools() {
        return SEND;
    }

    public static Set<String> knownTools() {
        return KNOWN;
    }

    @SafeVarargs
    private static Set<String> union(Set<String>... sets) {
        Set<String> all = new HashSet<>();
        for (Set<String> s : sets) {
            all.addAll(s);
        }
        return Set.copyOf(all);
    }
}
