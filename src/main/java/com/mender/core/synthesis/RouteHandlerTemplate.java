package com.mender.core.synthesis;

/**
 * Scaffold for a missing route handler. The generated handler redirects GET
 * requests to a working page and answers POST with a validated placeholder
 * result, so the endpoint stops failing while a real implementation is written.
 */
final class RouteHandlerTemplate {

    private static final String TEMPLATE = """
            import { NextRequest, NextResponse } from 'next/server';

            /**
             * Route handler for {{endpoint}}
             * Generated by Mender for anomaly {{anomalyId}}
             */
            export async function GET(request: NextRequest) {
              try {
                return NextResponse.redirect(new URL('{{fallbackRoute}}', request.url));
              } catch (error) {
                console.error('{{endpoint}} error:', error);
                return NextResponse.json(
                  { error: 'Service temporarily unavailable' },
                  { status: 503 }
                );
              }
            }

            export async function POST(request: NextRequest) {
              try {
                const body = await request.json();
                if (!body.url) {
                  return NextResponse.json({ error: 'URL is required' }, { status: 400 });
                }
                return NextResponse.json({
                  url: body.url,
                  status: 'accepted',
                  timestamp: new Date().toISOString()
                });
              } catch (error) {
                console.error('{{endpoint}} error:', error);
                return NextResponse.json({ error: 'Internal server error' }, { status: 500 });
              }
            }
            """;

    private RouteHandlerTemplate() {}

    static String render(String endpoint, String fallbackRoute, String anomalyId) {
        return TEMPLATE
                .replace("{{endpoint}}", endpoint)
                .replace("{{fallbackRoute}}", fallbackRoute)
                .replace("{{anomalyId}}", anomalyId == null ? "unknown" : anomalyId);
    }
}
